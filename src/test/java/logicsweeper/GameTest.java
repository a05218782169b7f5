package logicsweeper;

import org.junit.jupiter.api.Test;

import java.util.Optional;
import java.util.Random;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

public class GameTest{
	private static Game.Cell cell(int row, int col){
		return new Game.Cell(row, col);
	}

	@Test
	void oracleCountsNeighboringMines(){
		Game game = new Game(3, 3, Set.of(cell(0,0), cell(2,2)));
		assertTrue(game.isMine(cell(0,0)));
		assertFalse(game.isMine(cell(1,1)));
		assertEquals(2, game.neighborMineCount(cell(1,1)));
		assertEquals(1, game.neighborMineCount(cell(0,1)));
		assertEquals(0, game.neighborMineCount(cell(0,0)));
		assertEquals(0, game.neighborMineCount(cell(2,0)));
	}

	@Test
	void oracleRejectsCellsOffTheBoard(){
		Game game = new Game(3, 3, Set.of(cell(0,0)));
		assertThrows(IllegalArgumentException.class, () -> game.isMine(cell(3,0)));
		assertThrows(IllegalArgumentException.class, () -> game.neighborMineCount(cell(0,-1)));
		assertThrows(IllegalArgumentException.class, () -> new Game(2, 2, Set.of(cell(2,2))));
	}

	@Test
	void oracleNeedsMinesPlacedFirst(){
		Game game = new Game(5, 5, 3);
		assertEquals(Game.State.BEFORE, game.getState());
		assertThrows(IllegalStateException.class, () -> game.isMine(cell(0,0)));
		assertThrows(IllegalStateException.class, () -> game.neighborMineCount(cell(0,0)));
		assertThrows(IllegalStateException.class, game::won);
		//Flags can still go down before the first cell is opened
		game.flag(cell(4,4));
		assertEquals(Game.MINE, game.board[4][4]);
		assertEquals(Game.State.BEFORE, game.getState());
	}

	@Test
	void wonOnlyWhenFlagsMatchMines(){
		Game game = new Game(3, 3, Set.of(cell(0,0), cell(2,2)));
		assertFalse(game.won());
		game.flag(cell(0,0));
		game.flag(cell(1,1));
		assertFalse(game.won());
		game.flag(cell(1,1));
		game.flag(cell(2,2));
		assertTrue(game.won());
		assertEquals(Game.State.WIN, game.getState());
	}

	@Test
	void openingAMineLoses(){
		Game game = new Game(2, 2, Set.of(cell(1,1)));
		assertEquals(1, game.open(cell(0,0)));
		assertEquals(Game.State.ACTIVE, game.getState());
		assertEquals(Game.MINE, game.open(cell(1,1)));
		assertEquals(Game.State.LOSE, game.getState());
	}

	@Test
	void openingEverySafeCellWins(){
		Game game = new Game(1, 3, Set.of(cell(0,0)));
		game.open(cell(0,1));
		game.open(cell(0,2));
		assertEquals(Game.State.WIN, game.getState());
		assertEquals(0, game.board[0][2]);
		assertEquals(Game.UNKNOWN, game.board[0][0]);
	}

	@Test
	void zeroStartKeepsFirstNeighborhoodClear(){
		Game game = new Game(5, 5, 16);
		game.generateBoard(cell(2,2), new Random(11));
		for(int r=1; r<=3; r++){
			for(int c=1; c<=3; c++){
				assertFalse(game.isMine(cell(r,c)));
			}
		}
		int mines = 0;
		for(int r=0; r<5; r++){
			for(int c=0; c<5; c++){
				mines += game.isMine(cell(r,c)) ? 1 : 0;
			}
		}
		assertEquals(16, mines);
		assertThrows(IllegalArgumentException.class, () -> new Game(5, 5, 17));
	}

	@Test
	void attachedAgentPlaysUntilTheGameEnds(){
		Game game = new Game(1, 3, Set.of(cell(0,2)));
		Agent scripted = new Agent(){
			private int turn = 0;
			public void addKnowledge(Game.Cell cell, int count){
				assertEquals(cell(0,0), cell);
				assertEquals(0, count);
			}
			public Optional<Game.Cell> makeSafeMove(){
				return Optional.empty();
			}
			public Optional<Game.Cell> makeRandomMove(){
				return Optional.empty();
			}
			public Optional<Agent.Action> getMove(){
				turn++;
				if(turn==1){
					return Optional.of(new Agent.Action(Agent.Action.Type.OPEN, cell(0,0)));
				}
				return Optional.empty();
			}
		};
		game.attach(scripted);
		game.ai_play();
		assertEquals(Game.State.ACTIVE, game.getState());
		assertFalse(game.ai_move());
	}
}
