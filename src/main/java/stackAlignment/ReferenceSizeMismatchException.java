package stackAlignment;

/** Thrown when a supplied reference image does not have the XY size of the stack frames **/
public class ReferenceSizeMismatchException extends IllegalArgumentException
{
	private static final long serialVersionUID = 1L;

	public ReferenceSizeMismatchException(final String sMessage)
	{
		super(sMessage);
	}
}
