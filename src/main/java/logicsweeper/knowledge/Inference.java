package logicsweeper.knowledge;

import logicsweeper.Game;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

//Alternates extraction and subset resolution over a `KnowledgeBase` until a cycle changes nothing
//Resolution only swaps a sentence for strictly smaller ones and marking only shrinks them, so it ends
public class Inference{
	private static final Logger logger = LoggerFactory.getLogger(Inference.class);

	private final KnowledgeBase knowledge = new KnowledgeBase();
	private final Set<Game.Cell> mines = new HashSet<>();
	private final Set<Game.Cell> safes = new HashSet<>();

	public void markMine(Game.Cell cell){
		if(this.safes.contains(cell)){
			throw new InconsistentKnowledgeException(String.format("%s is already known to be safe", cell));
		}
		this.mines.add(cell);
		this.knowledge.markMine(cell);
	}
	public void markSafe(Game.Cell cell){
		if(this.mines.contains(cell)){
			throw new InconsistentKnowledgeException(String.format("%s is already known to be a mine", cell));
		}
		this.safes.add(cell);
		this.knowledge.markSafe(cell);
	}

	public boolean add(Sentence sentence){
		return this.knowledge.add(sentence);
	}

	//Returns how many cycles changed something, 0 at the fixpoint
	public int run(){
		int changes = 0;
		boolean changed;
		do{
			this.knowledge.verify();
			int marked = this.mines.size()+this.safes.size();
			boolean extracted = this.extract();
			int resolved = this.resolve();
			changed = extracted || resolved>0;
			if(changed){
				changes++;
				logger.debug("Cycle {}: {} cells marked, {} sentences resolved, {} sentences held",
					changes, this.mines.size()+this.safes.size()-marked, resolved, this.knowledge.size());
			}
		}while(changed);
		this.knowledge.verify();
		return changes;
	}

	//Returns whether any sentence gave a conclusion about at least one cell
	boolean extract(){
		boolean changed = false;
		for(Sentence s : this.knowledge.sentences()){
			//Copies, marking shrinks the sentence
			Optional<Set<Game.Cell>> found_mines = s.knownMines();
			if(found_mines.isPresent() && !found_mines.get().isEmpty()){
				for(Game.Cell cell : found_mines.get()){
					this.markMine(cell);
				}
				changed = true;
			}
			Optional<Set<Game.Cell>> found_safes = s.knownSafes();
			if(found_safes.isPresent() && !found_safes.get().isEmpty()){
				for(Game.Cell cell : found_safes.get()){
					this.markSafe(cell);
				}
				changed = true;
			}
		}
		this.knowledge.prune();
		return changed;
	}

	//Returns how many supersets were replaced
	int resolve(){
		List<Sentence> snapshot = new ArrayList<>(this.knowledge.sentences());
		List<Sentence> supersets = new ArrayList<>();
		List<Sentence> derived = new ArrayList<>();
		for(Sentence a : snapshot){
			boolean superset = false;
			for(Sentence b : snapshot){
				if(!b.equals(a) && b.isSubsetOf(a)){
					derived.add(a.subtract(b));
					superset = true;
				}
			}
			if(superset){
				supersets.add(a);
			}
		}
		for(Sentence a : supersets){
			this.knowledge.remove(a);
		}
		for(Sentence d : derived){
			this.knowledge.add(d);
		}
		return supersets.size();
	}

	public Set<Game.Cell> getMines(){
		return Collections.unmodifiableSet(this.mines);
	}
	public Set<Game.Cell> getSafes(){
		return Collections.unmodifiableSet(this.safes);
	}
	public KnowledgeBase getKnowledge(){
		return this.knowledge;
	}
}
