package logicsweeper.knowledge;

//How a new sentence accounts for neighbors that are already known mines
public enum CountPolicy{
	//Known mines are left out of the cells but the count is kept as revealed
	NOMINAL,
	//Known mines are left out of the cells and taken off the count
	ADJUSTED,
}
