package stackAlignment;

/** Thrown when alignment options are invalid or cannot be used together,
 * for example a reference together with progressive registration. **/
public class AlignmentConfigurationException extends IllegalArgumentException
{
	private static final long serialVersionUID = 1L;

	public AlignmentConfigurationException(final String sMessage)
	{
		super(sMessage);
	}
}
