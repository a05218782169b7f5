package logicsweeper.knowledge;

import logicsweeper.Game;
import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Optional;
import java.util.Set;

//Exactly `count` of `cells` are mines, equal by value
public class Sentence{
	private final Set<Game.Cell> cells;
	private int count;

	public Sentence(Collection<Game.Cell> cells, int count){
		this.cells = new HashSet<>(cells);
		this.count = count;
	}

	public Set<Game.Cell> getCells(){
		return Collections.unmodifiableSet(this.cells);
	}
	public int getCount(){
		return this.count;
	}
	public int size(){
		return this.cells.size();
	}

	public boolean isConsistent(){
		return this.count>=0 && this.count<=this.cells.size();
	}
	//Says nothing, can be dropped
	public boolean isVacuous(){
		return this.cells.isEmpty() && this.count==0;
	}

	//A copy of the cells when all of them are mines, empty when nothing follows
	public Optional<Set<Game.Cell>> knownMines(){
		if(this.cells.size()==this.count){
			return Optional.of(new HashSet<>(this.cells));
		}
		return Optional.empty();
	}
	//A copy of the cells when none of them are mines, empty when nothing follows
	public Optional<Set<Game.Cell>> knownSafes(){
		if(this.count==0){
			return Optional.of(new HashSet<>(this.cells));
		}
		return Optional.empty();
	}

	public void markMine(Game.Cell cell){
		if(this.cells.remove(cell)){
			this.count--;
		}
	}
	public void markSafe(Game.Cell cell){
		this.cells.remove(cell);
	}

	public boolean isSubsetOf(Sentence other){
		return other.cells.containsAll(this.cells);
	}
	//Not clamped, a negative count means the two sentences contradict each other
	public Sentence subtract(Sentence subset){
		Set<Game.Cell> rest = new HashSet<>(this.cells);
		rest.removeAll(subset.cells);
		return new Sentence(rest, this.count-subset.count);
	}

	public boolean equals(Object other){
		if(other instanceof Sentence){
			Sentence s = (Sentence) other;
			return s.count==this.count && s.cells.equals(this.cells);
		}
		return false;
	}
	public int hashCode(){
		return 31*this.cells.hashCode()+this.count;
	}
	public String toString(){
		return String.format("%s = %d", this.cells, this.count);
	}
}
