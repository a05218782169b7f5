package logicsweeper.knowledge;

import logicsweeper.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Random;
import java.util.Set;

//Plays only what it can prove from the clues, and guesses when it can't prove anything
public class KnowledgeAgent implements Agent{
	private static final Logger logger = LoggerFactory.getLogger(KnowledgeAgent.class);

	public final int height, width;
	private final Random random;
	private final CountPolicy policy;

	private final Set<Game.Cell> moves_made = new HashSet<>();
	private final Set<Game.Cell> flagged = new HashSet<>();
	private final Inference inference = new Inference();

	public KnowledgeAgent(int height, int width){
		this(height, width, new Random());
	}
	public KnowledgeAgent(int height, int width, Random random){
		this(height, width, random, CountPolicy.NOMINAL);
	}
	public KnowledgeAgent(int height, int width, Random random, CountPolicy policy){
		if(height<=0 || width<=0){
			throw new IllegalArgumentException(String.format("Can't play on a %dx%d board",height,width));
		}
		this.height = height;
		this.width = width;
		this.random = random;
		this.policy = policy;
	}
	public static Agent newAgent(Game game){
		return new KnowledgeAgent(game.height, game.width);
	}
	public static Agent newAgent(Game game, Random random){
		return new KnowledgeAgent(game.height, game.width, random);
	}

	public void addKnowledge(Game.Cell cell, int count){
		if(!this.in_bounds(cell)){
			throw new IllegalArgumentException(String.format("%s is out of bounds for %dx%d", cell, this.height, this.width));
		}
		List<Game.Cell> neighbors = this.neighbors(cell);
		if(count<0 || count>neighbors.size()){
			throw new IllegalArgumentException(String.format("%s can't border %d mines, it has %d neighbors", cell, count, neighbors.size()));
		}
		this.moves_made.add(cell);
		this.inference.markSafe(cell);

		List<Game.Cell> unknown = new ArrayList<>();
		int known_mines = 0;
		for(Game.Cell n : neighbors){
			if(this.inference.getMines().contains(n)){
				known_mines++;
			}
			else if(!this.moves_made.contains(n) && !this.inference.getSafes().contains(n)){
				unknown.add(n);
			}
		}
		int adjusted = this.policy==CountPolicy.ADJUSTED ? count-known_mines : count;
		this.inference.add(new Sentence(unknown, adjusted));
		this.inference.run();
	}

	public Optional<Game.Cell> makeSafeMove(){
		List<Game.Cell> candidates = new ArrayList<>();
		for(int r=0; r<this.height; r++){
			for(int c=0; c<this.width; c++){
				Game.Cell cell = new Game.Cell(r,c);
				if(this.inference.getSafes().contains(cell) && !this.moves_made.contains(cell)){
					candidates.add(cell);
				}
			}
		}
		return this.pick(candidates);
	}
	public Optional<Game.Cell> makeRandomMove(){
		List<Game.Cell> candidates = new ArrayList<>();
		for(int r=0; r<this.height; r++){
			for(int c=0; c<this.width; c++){
				Game.Cell cell = new Game.Cell(r,c);
				if(!this.moves_made.contains(cell) && !this.inference.getMines().contains(cell)){
					candidates.add(cell);
				}
			}
		}
		return this.pick(candidates);
	}
	private Optional<Game.Cell> pick(List<Game.Cell> candidates){
		if(candidates.isEmpty()){
			return Optional.empty();
		}
		return Optional.of(candidates.get(this.random.nextInt(candidates.size())));
	}

	public Optional<Agent.Action> getMove(){
		//Flag what's been proven before opening anything else
		for(int r=0; r<this.height; r++){
			for(int c=0; c<this.width; c++){
				Game.Cell cell = new Game.Cell(r,c);
				if(this.inference.getMines().contains(cell) && this.flagged.add(cell)){
					return Optional.of(new Agent.Action(Agent.Action.Type.FLAG, cell));
				}
			}
		}
		Optional<Game.Cell> safe = this.makeSafeMove();
		if(safe.isPresent()){
			return Optional.of(new Agent.Action(Agent.Action.Type.OPEN, safe.get()));
		}
		Optional<Game.Cell> guess = this.makeRandomMove();
		if(guess.isPresent()){
			logger.debug("No safe move known, guessing {} ({} mines known)", guess.get(), this.inference.getMines().size());
			return Optional.of(new Agent.Action(Agent.Action.Type.OPEN, guess.get()));
		}
		return Optional.empty();
	}

	public Set<Game.Cell> getMovesMade(){
		return Collections.unmodifiableSet(this.moves_made);
	}
	public Set<Game.Cell> getSafes(){
		return this.inference.getSafes();
	}
	public Set<Game.Cell> getMines(){
		return this.inference.getMines();
	}
	public KnowledgeBase getKnowledge(){
		return this.inference.getKnowledge();
	}

	private boolean in_bounds(Game.Cell pos){
		return pos.row>=0 && pos.col>=0 && pos.row<this.height && pos.col<this.width;
	}
	private List<Game.Cell> neighbors(Game.Cell pos){
		List<Game.Cell> ans = new ArrayList<>();
		for(int r=-1; r<=1; r++){
			for(int c=-1; c<=1; c++){
				Game.Cell n = new Game.Cell(pos.row+r, pos.col+c);
				if((r|c)!=0 && this.in_bounds(n)){
					ans.add(n);
				}
			}
		}
		return ans;
	}
}
