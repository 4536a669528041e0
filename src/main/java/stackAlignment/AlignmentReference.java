package stackAlignment;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.RealType;

/** What the frames are registered against **/
public final class AlignmentReference {

	public enum Kind {
		/** windowed sum around the first frame of the first trial block **/
		INITIAL_WINDOW,
		/** supplied 2D image **/
		IMAGE,
		/** windowed sum around the supplied frame **/
		FRAME
	}

	public final Kind kind;

	/** reference image for {@link Kind#IMAGE}, null otherwise **/
	public final MaskedImage image;

	/** 1-based frame for {@link Kind#FRAME}, 0 otherwise **/
	public final int nFrame;

	private AlignmentReference(final Kind kind_, final MaskedImage image_, final int nFrame_)
	{
		kind = kind_;
		image = image_;
		nFrame = nFrame_;
	}

	public static AlignmentReference none()
	{
		return new AlignmentReference(Kind.INITIAL_WINDOW, null, 0);
	}

	/** 2D reference image [X,Y], NaN samples are missing **/
	public static < T extends RealType< T > > AlignmentReference image(final RandomAccessibleInterval< T > img)
	{
		if(img == null)
		{
			throw new AlignmentConfigurationException("AlignmentReference: reference image is null.");
		}
		if(img.numDimensions() != 2)
		{
			throw new ReferenceSizeMismatchException("AlignmentReference: reference image should be 2D, provided "
								+ img.numDimensions() + "D image.");
		}
		return new AlignmentReference(Kind.IMAGE, MaskedImage.fromReal( img ), 0);
	}

	public static AlignmentReference frame(final int nFrame)
	{
		return new AlignmentReference(Kind.FRAME, null, nFrame);
	}

	public boolean isNone()
	{
		return kind == Kind.INITIAL_WINDOW;
	}

	@Override
	public String toString()
	{
		switch(kind)
		{
			case IMAGE:
				return "image " + MiscUtils.getDimensionsText( image.values );
			case FRAME:
				return "frame " + nFrame;
			default:
				return "initial window";
		}
	}
}
