package logicsweeper;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

//Knows where the mines are and referees an attached `Agent`
public class Game{
	//A board coordinate, equal by value
	public static class Cell{
		public final int row;
		public final int col;
		public Cell(int row, int col){
			this.row=row;
			this.col=col;
		}
		public boolean equals(Object other){
			if(!(other instanceof Cell)){
				return false;
			}
			Cell that = (Cell) other;
			return this.row==that.row && this.col==that.col;
		}
		public int hashCode(){
			return 31*this.row+this.col;
		}
		public String toString(){
			return "("+this.row+","+this.col+")";
		}
	}
	//Ordered, anything after ACTIVE means the game is over
	public enum State{
		BEFORE,
		READY,
		ACTIVE,
		WIN,
		LOSE,
	}

	public final int height, width, mines;
	//Keep the first opened cell's neighbors clear as well
	public final boolean zero_start;

	//What the player sees: clues 0-8, MINE for flags and opened mines, UNKNOWN otherwise
	public final int[][] board;
	public static final int MINE = 9;
	public static final int UNKNOWN = -1;

	private final boolean[][] mined;
	private final boolean[][] opened;
	private final boolean[][] flagged;
	private int safe_left;
	protected State state = State.BEFORE;
	protected Agent ai;

	public Game(int height, int width, Set<Cell> mine_cells){
		this(height, width, mine_cells.size(), false);
		for(Cell mine : mine_cells){
			if(!this.in_bounds(mine)){
				throw new IllegalArgumentException(String.format("%s is out of bounds for %dx%d", mine, height, width));
			}
			this.mined[mine.row][mine.col] = true;
		}
		this.ready();
	}
	public Game(int height, int width, int mines){
		this(height, width, mines, true);
	}
	public Game(int height, int width, int mines, boolean zero_start){
		if(height<=0 || width<=0){
			throw new IllegalArgumentException(String.format("Can't make a %dx%d board",height,width));
		}
		int cleared = zero_start ? Math.min(9, height*width) : 1;
		if(mines<0 || mines>height*width-cleared){
			throw new IllegalArgumentException(String.format("Can't fit %d mines",mines));
		}
		this.height=height;
		this.width=width;
		this.mines=mines;
		this.zero_start=zero_start;
		this.board = new int[height][width];
		for(int[] row : this.board){
			Arrays.fill(row, UNKNOWN);
		}
		this.mined = new boolean[height][width];
		this.opened = new boolean[height][width];
		this.flagged = new boolean[height][width];
	}

	protected void generateBoard(Cell first_cell){
		this.generateBoard(first_cell, new Random());
	}
	protected void generateBoard(Cell first_cell, Random random){
		int clear_radius = this.zero_start ? 1 : 0;
		List<Cell> free = new ArrayList<>();
		for(int r=0; r<this.height; r++){
			for(int c=0; c<this.width; c++){
				if(Math.abs(first_cell.row-r)>clear_radius || Math.abs(first_cell.col-c)>clear_radius){
					free.add(new Cell(r,c));
				}
			}
		}
		for(int i=0; i<this.mines; i++){
			Cell mine = free.remove(random.nextInt(free.size()));
			this.mined[mine.row][mine.col] = true;
		}
		this.ready();
	}
	private void ready(){
		this.safe_left = this.height*this.width-this.mines;
		this.state = State.READY;
	}

	public boolean isMine(Cell cell){
		this.checkPlaced(cell);
		return this.mined[cell.row][cell.col];
	}
	public int neighborMineCount(Cell cell){
		this.checkPlaced(cell);
		int count = 0;
		for(Cell n : this.neighbors(cell)){
			if(this.mined[n.row][n.col]){
				count++;
			}
		}
		return count;
	}
	//True once the flags sit exactly on the mines
	public boolean won(){
		this.checkPlaced();
		for(int r=0; r<this.height; r++){
			for(int c=0; c<this.width; c++){
				if(this.flagged[r][c] != this.mined[r][c]){
					return false;
				}
			}
		}
		return true;
	}
	private void checkPlaced(){
		if(this.state == State.BEFORE){
			throw new IllegalStateException("Mines have not been placed yet");
		}
	}
	private void checkPlaced(Cell cell){
		if(!this.in_bounds(cell)){
			throw new IllegalArgumentException(String.format("%s is out of bounds for %dx%d", cell, this.height, this.width));
		}
		this.checkPlaced();
	}

	//Toggles a flag, flags may go down before the mines are placed
	public void flag(Cell cell){
		if(!this.in_bounds(cell)){
			throw new IllegalArgumentException(String.format("Can't flag at %s",cell));
		}
		if(this.state.compareTo(State.ACTIVE) > 0 || this.opened[cell.row][cell.col]){
			return;
		}
		boolean flag = !this.flagged[cell.row][cell.col];
		this.flagged[cell.row][cell.col] = flag;
		this.board[cell.row][cell.col] = flag ? MINE : UNKNOWN;
		if(this.state != State.BEFORE && this.won()){
			this.setState(State.WIN);
		}
	}
	//Returns what the player now sees at `cell`
	public int open(Cell cell){
		if(!this.in_bounds(cell)){
			throw new IllegalArgumentException(String.format("Can't open at %s",cell));
		}
		if(this.state == State.BEFORE){
			this.generateBoard(cell);
		}
		if(this.state == State.READY){
			this.setState(State.ACTIVE);
		}
		if(this.state != State.ACTIVE || this.flagged[cell.row][cell.col] || this.opened[cell.row][cell.col]){
			return this.board[cell.row][cell.col];
		}
		this.opened[cell.row][cell.col] = true;
		if(this.mined[cell.row][cell.col]){
			this.board[cell.row][cell.col] = MINE;
			this.setState(State.LOSE);
			return MINE;
		}
		int clue = this.neighborMineCount(cell);
		this.board[cell.row][cell.col] = clue;
		if(--this.safe_left == 0){
			this.setState(State.WIN);
		}
		return clue;
	}

	public State getState(){
		return this.state;
	}
	//Subclasses hook in here to watch the game start and end
	protected void setState(State state){
		this.state = state;
	}

	public void attach(Agent a){
		this.ai = a;
	}
	protected void process_action(Agent.Action move){
		if(move.cell==null || move.type==null){
			throw new NullPointerException("AI returned an incomplete move");
		}
		switch(move.type){
			case OPEN:
				int clue = this.open(move.cell);
				//A lost game or a move the board ignored teaches nothing
				if(this.state != State.LOSE && clue != MINE && clue != UNKNOWN){
					this.ai.addKnowledge(move.cell, clue);
				}
				break;
			case FLAG:
				this.flag(move.cell);
				break;
		}
	}
	//Returns false when there is no AI or it has no move left
	public boolean ai_move(){
		if(this.ai == null){
			return false;
		}
		Optional<Agent.Action> move = this.ai.getMove();
		move.ifPresent(this::process_action);
		return move.isPresent();
	}
	public void ai_play(){
		while(this.state.compareTo(State.ACTIVE) <= 0){
			if(!this.ai_move()){
				return;
			}
		}
	}

	private boolean in_bounds(Cell cell){
		return cell.row>=0 && cell.col>=0 && cell.row<this.height && cell.col<this.width;
	}
	private List<Cell> neighbors(Cell cell){
		List<Cell> ans = new ArrayList<>();
		for(int r=Math.max(0, cell.row-1); r<=Math.min(this.height-1, cell.row+1); r++){
			for(int c=Math.max(0, cell.col-1); c<=Math.min(this.width-1, cell.col+1); c++){
				if(r!=cell.row || c!=cell.col){
					ans.add(new Cell(r,c));
				}
			}
		}
		return ans;
	}
}
