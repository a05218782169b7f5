package logicsweeper;

import java.util.Optional;

//A player that only learns about the board through the clues a `Game` hands it
public interface Agent{
	//Data class to be given to a `logicsweeper.Game` as instructions for what to do
	public static class Action{
		public enum Type{
			OPEN,
			FLAG,
		}
		public final Type type;
		public final Game.Cell cell;
		public Action(Type type, Game.Cell cell){
			this.type=type;
			this.cell=cell;
		}
		public String toString(){
			return this.type+" "+this.cell;
		}
	}

	//`cell` was opened safely and borders `count` mines
	public void addKnowledge(Game.Cell cell, int count);
	//A cell known to be safe that hasn't been opened yet
	public Optional<Game.Cell> makeSafeMove();
	//Any cell not opened yet and not known to be a mine
	public Optional<Game.Cell> makeRandomMove();
	//Empty once there is nothing left to do
	public Optional<Action> getMove();
}
