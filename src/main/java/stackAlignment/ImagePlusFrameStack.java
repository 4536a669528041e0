package stackAlignment;

import ij.ImagePlus;

/** Frame stack over ImageJ ImagePlus (8, 16 or 32 bit).
 * Only requested planes are read and converted to float.
 * Time points are frames, slices are used instead if there is a single time point. **/
public class ImagePlusFrameStack extends AbstractFrameStack {

	final ImagePlus imp;

	final ImagePlus impBlank;

	/** frames are along T (otherwise along Z) **/
	final boolean bFramesAreT;

	public ImagePlusFrameStack(final ImagePlus imp_)
	{
		this(imp_, null);
	}

	public ImagePlusFrameStack(final ImagePlus imp_, final ImagePlus impBlank_)
	{
		checkBitDepth( imp_ );
		imp = imp_;
		if(imp.getNFrames() > 1 && imp.getNSlices() > 1)
		{
			throw new IllegalArgumentException("ImagePlusFrameStack: image " + imp.getTitle() + " has both Z and T axes ("
								+ "Z=" + imp.getNSlices() + ", T=" + imp.getNFrames() + "), only one of them can be used as frames.");
		}
		bFramesAreT = imp.getNFrames() > 1;
		if(impBlank_ != null)
		{
			checkBitDepth( impBlank_ );
			if(impBlank_.getWidth() != imp.getWidth() || impBlank_.getHeight() != imp.getHeight()
					|| impBlank_.getNChannels() != imp.getNChannels()
					|| impBlank_.getStackSize() != imp.getStackSize())
			{
				throw new IllegalArgumentException("ImagePlusFrameStack: blank image " + impBlank_.getTitle()
									+ " should have the same dimensions as " + imp.getTitle() + ".");
			}
		}
		impBlank = impBlank_;
	}

	static void checkBitDepth(final ImagePlus ip)
	{
		final int nBitD = ip.getBitDepth();
		if(nBitD != 8 && nBitD != 16 && nBitD != 32)
		{
			throw new IllegalArgumentException("ImagePlusFrameStack: only 8, 16 and 32-bit images are supported, "
								+ ip.getTitle() + " is " + nBitD + "-bit.");
		}
	}

	@Override
	public long getWidth()
	{
		return imp.getWidth();
	}

	@Override
	public long getHeight()
	{
		return imp.getHeight();
	}

	@Override
	public int getNFrames()
	{
		return bFramesAreT ? imp.getNFrames() : imp.getNSlices();
	}

	@Override
	public int getNChannels()
	{
		return imp.getNChannels();
	}

	@Override
	public boolean hasBlank()
	{
		return impBlank != null;
	}

	@Override
	protected void readRawPlane(final int nFrame, final int nChannel, final float [] target, final int nOffset)
	{
		copyPlane( imp, nFrame, nChannel, target, nOffset );
	}

	@Override
	protected void readBlankPlane(final int nFrame, final int nChannel, final float [] target, final int nOffset)
	{
		copyPlane( impBlank, nFrame, nChannel, target, nOffset );
	}

	void copyPlane(final ImagePlus ip, final int nFrame, final int nChannel, final float [] target, final int nOffset)
	{
		final int nStackInd = bFramesAreT ? ip.getStackIndex( nChannel, 1, nFrame ) : ip.getStackIndex( nChannel, nFrame, 1 );
		final int nPlaneSize = ip.getWidth()*ip.getHeight();
		final Object pixels = ip.getStack().getProcessor( nStackInd ).getPixels();
		switch(ip.getBitDepth())
		{
			case 32:
				System.arraycopy( pixels, 0, target, nOffset, nPlaneSize );
				break;
			case 16:
				final short [] shortData = (short []) pixels;
				for(int i=0;i<nPlaneSize;i++)
				{
					target[nOffset+i] = shortData[i]&0xffff;
				}
				break;
			case 8:
				final byte [] byteData = (byte []) pixels;
				for(int i=0;i<nPlaneSize;i++)
				{
					target[nOffset+i] = byteData[i]&0xff;
				}
				break;
			default:
				break;
		}
	}
}
