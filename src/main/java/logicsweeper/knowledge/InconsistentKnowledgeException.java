package logicsweeper.knowledge;

//The inference itself went wrong, not the clue it was given
public class InconsistentKnowledgeException extends IllegalStateException{
	public InconsistentKnowledgeException(String message){
		super(message);
	}
}
