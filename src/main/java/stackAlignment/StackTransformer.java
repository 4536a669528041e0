package stackAlignment;

import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.RealRandomAccess;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.interpolation.randomaccess.NLinearInterpolatorFactory;
import net.imglib2.loops.LoopBuilder;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.view.Views;

/** Applies measured offsets to frames, producing an aligned (drift corrected) stack **/
public class StackTransformer {

	/** translates the frame by the negated offset, n-linear interpolation, zero outside.
	 * Pixel (x,y) of the output is taken from (x+dShiftX, y+dShiftY) of the frame. **/
	public static Img< FloatType > alignFrame(final RandomAccessibleInterval< FloatType > frame, final double dShiftY, final double dShiftX)
	{
		final RandomAccessibleInterval< FloatType > frame0 = Views.zeroMin( frame );
		final RealRandomAccess< FloatType > rra = Views.interpolate( Views.extendZero( frame0 ),
															new NLinearInterpolatorFactory< FloatType >() ).realRandomAccess();
		final Img< FloatType > out = ArrayImgs.floats( frame0.dimension( 0 ), frame0.dimension( 1 ) );
		final Cursor< FloatType > cursor = out.localizingCursor();
		while(cursor.hasNext())
		{
			cursor.fwd();
			rra.setPosition( cursor.getDoublePosition( 0 ) + dShiftX, 0 );
			rra.setPosition( cursor.getDoublePosition( 1 ) + dShiftY, 1 );
			cursor.get().set( rra.get() );
		}
		return out;
	}

	/** aligns all frames of one channel (1-based), returns [X,Y,F] image **/
	public static Img< FloatType > alignStack(final FrameStack stack, final FrameOffsets offsets, final int nChannel)
	{
		if(offsets.getNFrames() != stack.getNFrames())
		{
			throw new FrameBoundsException("StackTransformer: offsets are provided for " + offsets.getNFrames()
								+ " frames, the stack has " + stack.getNFrames() + " frames.");
		}
		final Img< FloatType > out = ArrayImgs.floats( stack.getWidth(), stack.getHeight(), stack.getNFrames() );
		for(int nFrame=1;nFrame<=stack.getNFrames();nFrame++)
		{
			final RandomAccessibleInterval< FloatType > frame = Views.hyperSlice( Views.hyperSlice(
					stack.readFrames( new int [] {nFrame}, new int [] {nChannel} ), 3, 0 ), 2, 0 );
			LoopBuilder.setImages( alignFrame( frame, offsets.getVerticalShift( nFrame ), offsets.getHorizontalShift( nFrame ) ),
									Views.hyperSlice( out, 2, nFrame - 1 ) ).forEachPixel(
					(s, t)->t.set( s ));
		}
		return out;
	}
}
