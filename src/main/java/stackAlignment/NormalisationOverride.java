package stackAlignment;

/** Switches blank normalisation of a stack for the duration of a try-with-resources block
 * and restores the previous mode on close. **/
public class NormalisationOverride implements AutoCloseable {

	final FrameStack stack;

	final BlankNormalisation previousMode;

	boolean bClosed = false;

	public NormalisationOverride(final FrameStack stack_, final BlankNormalisation mode)
	{
		stack = stack_;
		previousMode = stack.getNormalisation();
		stack.setNormalisation( mode );
	}

	public BlankNormalisation getPreviousMode()
	{
		return previousMode;
	}

	@Override
	public void close()
	{
		if(!bClosed)
		{
			stack.setNormalisation( previousMode );
			bClosed = true;
		}
	}
}
