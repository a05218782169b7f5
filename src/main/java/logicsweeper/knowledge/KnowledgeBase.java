package logicsweeper.knowledge;

import logicsweeper.Game;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

//The sentences an agent holds as true, in order, with no duplicates and nothing vacuous
public class KnowledgeBase{
	private final List<Sentence> sentences = new ArrayList<>();

	//Returns false when the sentence adds nothing
	public boolean add(Sentence sentence){
		if(sentence.isVacuous() || this.sentences.contains(sentence)){
			return false;
		}
		return this.sentences.add(sentence);
	}
	//Removes the first sentence equal to `sentence`
	public boolean remove(Sentence sentence){
		return this.sentences.remove(sentence);
	}
	public boolean contains(Sentence sentence){
		return this.sentences.contains(sentence);
	}

	public void markMine(Game.Cell cell){
		for(Sentence s : this.sentences){
			s.markMine(cell);
		}
	}
	public void markSafe(Game.Cell cell){
		for(Sentence s : this.sentences){
			s.markSafe(cell);
		}
	}

	//Marking can leave sentences empty or equal to each other
	public void prune(){
		Set<Sentence> seen = new HashSet<>();
		Iterator<Sentence> it = this.sentences.iterator();
		while(it.hasNext()){
			Sentence s = it.next();
			if(s.isVacuous() || !seen.add(s)){
				it.remove();
			}
		}
	}

	public void verify(){
		for(Sentence s : this.sentences){
			if(!s.isConsistent()){
				throw new InconsistentKnowledgeException(String.format("Sentence %s has a count outside 0..%d", s, s.size()));
			}
		}
	}

	public List<Sentence> sentences(){
		return Collections.unmodifiableList(this.sentences);
	}
	public int size(){
		return this.sentences.size();
	}
	public boolean isEmpty(){
		return this.sentences.isEmpty();
	}
	public String toString(){
		return this.sentences.toString();
	}
}
