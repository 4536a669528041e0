package stackAlignment;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.loops.LoopBuilder;
import net.imglib2.type.numeric.RealType;
import net.imglib2.util.Intervals;
import net.imglib2.view.Views;

/** Frame stack on top of imglib2 image [X,Y,F] or [X,Y,F,C] of any real type,
 * with optional blank frames of the same size **/
public class ImgFrameStack< T extends RealType< T > > extends AbstractFrameStack {

	/** always 4D [X,Y,F,C] **/
	final RandomAccessibleInterval< T > data;

	final RandomAccessibleInterval< T > blankData;

	public ImgFrameStack(final RandomAccessibleInterval< T > img)
	{
		this(img, null);
	}

	public ImgFrameStack(final RandomAccessibleInterval< T > img, final RandomAccessibleInterval< T > blank)
	{
		data = toXYFC( img );
		if(blank != null)
		{
			if(!Intervals.equalDimensions( img, blank ))
			{
				throw new IllegalArgumentException("ImgFrameStack: blank frames size " + MiscUtils.getDimensionsText( blank )
									+ " differs from the stack size " + MiscUtils.getDimensionsText( img ) + ".");
			}
			blankData = toXYFC( blank );
		}
		else
		{
			blankData = null;
		}
	}

	static < T extends RealType< T > > RandomAccessibleInterval< T > toXYFC(final RandomAccessibleInterval< T > img)
	{
		if(img.numDimensions() == 3)
		{
			return Views.addDimension( Views.zeroMin( img ), 0, 0 );
		}
		if(img.numDimensions() == 4)
		{
			return Views.zeroMin( img );
		}
		throw new IllegalArgumentException("ImgFrameStack: stack should be 3D [X,Y,F] or 4D [X,Y,F,C], provided "
								+ img.numDimensions() + "D image.");
	}

	@Override
	public long getWidth()
	{
		return data.dimension( 0 );
	}

	@Override
	public long getHeight()
	{
		return data.dimension( 1 );
	}

	@Override
	public int getNFrames()
	{
		return (int) data.dimension( 2 );
	}

	@Override
	public int getNChannels()
	{
		return (int) data.dimension( 3 );
	}

	@Override
	public boolean hasBlank()
	{
		return blankData != null;
	}

	@Override
	protected void readRawPlane(final int nFrame, final int nChannel, final float [] target, final int nOffset)
	{
		copyPlane( data, nFrame, nChannel, target, nOffset );
	}

	@Override
	protected void readBlankPlane(final int nFrame, final int nChannel, final float [] target, final int nOffset)
	{
		copyPlane( blankData, nFrame, nChannel, target, nOffset );
	}

	void copyPlane(final RandomAccessibleInterval< T > source, final int nFrame, final int nChannel, final float [] target, final int nOffset)
	{
		final RandomAccessibleInterval< T > plane = Views.hyperSlice( Views.hyperSlice( source, 3, nChannel - 1 ), 2, nFrame - 1 );
		final float [] planeData = new float [(int)(getWidth()*getHeight())];
		LoopBuilder.setImages( plane, ArrayImgs.floats( planeData, getWidth(), getHeight() ) ).forEachPixel(
				(s, t)->t.set( s.getRealFloat() ));
		System.arraycopy( planeData, 0, target, nOffset, planeData.length );
	}
}
