package logicsweeper;

import logicsweeper.knowledge.InconsistentKnowledgeException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.text.DecimalFormat;
import java.util.Random;
import java.util.function.BiFunction;

//Plays many seeded games with one kind of agent and keeps score
public class Trials extends Game{
	private static final Logger logger = LoggerFactory.getLogger(Trials.class);

	protected long startTime;
	protected long endTime;

	public Trials(int height, int width, int mines){
		this(height, width, mines, true);
	}
	public Trials(int height, int width, int mines, boolean zero_start){
		super(height,width,mines,zero_start);
	}

	public long seed;
	protected void generateBoard(Cell first_cell){
		this.generateBoard(first_cell, new Random(this.seed));
	}

	protected void setState(State state){
		super.setState(state);
		if(state==State.ACTIVE){
			this.startTime = System.nanoTime();
		}
		else if(state==State.WIN || state==State.LOSE){
			this.endTime = System.nanoTime();
		}
	}

	public static class Settings{
		public int trials = 1000;
		public int height = 16;
		public int width = 30;
		public int mines = 99;
		public boolean zero_start = true;
		public long seed = new Random().nextLong();
		//Given the game to play and the random source the agent should use
		public final BiFunction<Game, Random, Agent> agent;
		public Settings(BiFunction<Game, Random, Agent> agent){
			this.agent = agent;
		}
	}

	public static class Result{
		public int wins;
		public int losses;
		//Stopped by contradictory knowledge
		public int aborted;
		//Agent ran out of moves before the game ended
		public int unfinished;
		public long total_time;
		public long max_time;

		public int completed(){
			return this.wins+this.losses;
		}
		public double winRate(){
			return this.completed()==0 ? 0 : (double)this.wins/this.completed();
		}
		public String toString(){
			DecimalFormat f = new DecimalFormat("#.####");
			double elapsed_seconds = this.total_time/Math.pow(10,9);
			double max_seconds = this.max_time/Math.pow(10,9);
			double average_seconds = this.completed()==0 ? 0 : elapsed_seconds/this.completed();
			return String.format(
				"%d wins out of %d - %s%% (%d aborted, %d unfinished); %s seconds total; %s maximum; %s average",
				this.wins, this.completed(), f.format(this.winRate()*100), this.aborted, this.unfinished,
				f.format(elapsed_seconds), f.format(max_seconds), f.format(average_seconds)
			);
		}
	}

	public static Result run(Settings settings){
		logger.info("Seed {}: {} games on a {}x{}x{} {}board", Long.toUnsignedString(settings.seed), settings.trials,
			settings.height, settings.width, settings.mines, settings.zero_start ? "" : "classic ");
		Result result = new Result();
		for(int i=0; i<settings.trials; i++){
			final Trials game = new Trials(settings.height, settings.width, settings.mines, settings.zero_start);
			Random trial_random = new Random(settings.seed+i);
			game.seed = trial_random.nextLong();
			game.attach(settings.agent.apply(game, new Random(trial_random.nextLong())));
			try{
				game.ai_play();
			}
			catch(InconsistentKnowledgeException e){
				logger.warn("Game {} (board seed {}) aborted: {}", i, Long.toUnsignedString(game.seed), e.getMessage());
				result.aborted++;
				continue;
			}
			if(game.getState()==State.WIN){
				result.wins++;
			}
			else if(game.getState()==State.LOSE){
				result.losses++;
			}
			else{
				result.unfinished++;
				continue;
			}
			long elapsed = game.endTime-game.startTime;
			result.total_time += elapsed;
			result.max_time = Math.max(result.max_time, elapsed);
		}
		logger.info("{}", result);
		return result;
	}
}
