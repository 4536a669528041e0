package stackAlignment;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.real.FloatType;

/** Frame stack reading plane by plane, with blank normalisation and index checks **/
public abstract class AbstractFrameStack implements FrameStack {

	protected BlankNormalisation normalisation = BlankNormalisation.NONE;

	/** reads raw plane of the stack into target (row-major, X fastest) starting at nOffset **/
	protected abstract void readRawPlane(int nFrame, int nChannel, float [] target, int nOffset);

	/** reads the blank plane into target (row-major, X fastest) starting at nOffset **/
	protected abstract void readBlankPlane(int nFrame, int nChannel, float [] target, int nOffset);

	public abstract boolean hasBlank();

	@Override
	public BlankNormalisation getNormalisation()
	{
		return normalisation;
	}

	@Override
	public void setNormalisation(final BlankNormalisation mode)
	{
		if(mode == null)
		{
			throw new IllegalArgumentException("FrameStack: normalisation mode cannot be null.");
		}
		if(mode != BlankNormalisation.NONE && !hasBlank())
		{
			throw new IllegalArgumentException("FrameStack: normalisation " + mode + " needs blank frames, but none were provided.");
		}
		normalisation = mode;
	}

	@Override
	public RandomAccessibleInterval< FloatType > readFrames(final int [] frames, final int [] channels)
	{
		checkIndices( frames, getNFrames(), "frame" );
		checkIndices( channels, getNChannels(), "channel" );
		final long nTotalSize = getWidth()*getHeight()*frames.length*channels.length;
		if(nTotalSize > Integer.MAX_VALUE)
		{
			throw new IllegalArgumentException("FrameStack: " + frames.length + " frame(s) and " + channels.length + " channel(s) of "
								+ getWidth() + "x" + getHeight() + " pixels do not fit into a single array.");
		}
		final int nPlaneSize = (int)(getWidth()*getHeight());
		final float [] data = new float [(int) nTotalSize];
		final float [] blank = (normalisation == BlankNormalisation.NONE) ? null : new float [nPlaneSize];
		int nOffset;
		for(int c=0;c<channels.length;c++)
			for(int f=0;f<frames.length;f++)
			{
				nOffset = (c*frames.length + f)*nPlaneSize;
				readRawPlane( frames[f], channels[c], data, nOffset );
				if(blank != null)
				{
					readBlankPlane( frames[f], channels[c], blank, 0 );
					normalise( data, nOffset, blank, nPlaneSize );
				}
			}
		return ArrayImgs.floats( data, getWidth(), getHeight(), frames.length, channels.length );
	}

	void normalise(final float [] data, final int nOffset, final float [] blank, final int nPlaneSize)
	{
		float fRaw, fBlank;
		for(int i=0;i<nPlaneSize;i++)
		{
			fRaw = data[nOffset+i];
			fBlank = blank[i];
			if(Float.isNaN( fBlank ))
			{
				// keep raw value where blank is missing
				continue;
			}
			if(normalisation == BlankNormalisation.SUBTRACT)
			{
				data[nOffset+i] = fRaw - fBlank;
			}
			else
			{
				data[nOffset+i] = (fRaw - fBlank)/fBlank;
			}
		}
	}

	static void checkIndices(final int [] indices, final int nMax, final String sName)
	{
		if(indices == null || indices.length == 0)
		{
			throw new IllegalArgumentException("FrameStack: no " + sName + " indices provided.");
		}
		for(final int nInd : indices)
		{
			if(nInd < 1 || nInd > nMax)
			{
				throw new FrameBoundsException("FrameStack: " + sName + " index " + nInd + " is outside of range [1, " + nMax + "].");
			}
		}
	}
}
