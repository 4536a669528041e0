package stackAlignment;

/** Thrown when a trial range, averaging window, reference frame or channel
 * refers to an index outside of the stack **/
public class FrameBoundsException extends IndexOutOfBoundsException
{
	private static final long serialVersionUID = 1L;

	public FrameBoundsException(final String sMessage)
	{
		super(sMessage);
	}
}
