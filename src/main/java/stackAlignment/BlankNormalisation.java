package stackAlignment;

/** How the stack combines raw frames with blank (background) frames on reading **/
public enum BlankNormalisation {
	/** raw values **/
	NONE,
	/** raw - blank **/
	SUBTRACT,
	/** (raw - blank)/blank, i.e. dF/F **/
	DIVIDE
}
