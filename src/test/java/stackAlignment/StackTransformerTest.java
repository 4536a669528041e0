package stackAlignment;

import static org.junit.Assert.assertEquals;

import org.junit.Test;

import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.Img;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.view.Views;

public class StackTransformerTest {

	@Test
	public void alignedStackMatchesFirstFrame()
	{
		final double [][] shifts = new double [][] {{0, 0}, {3, -2}, {-1, 5}};
		final ImgFrameStack< FloatType > stack = new ImgFrameStack<>(SyntheticStacks.stack( 64, 64, shifts ));
		final FrameOffsets offsets = StackAligner.computeStackAlignment( stack, new AlignmentParameters() );
		final Img< FloatType > aligned = StackTransformer.alignStack( stack, offsets, 1 );
		final Img< FloatType > reference = SyntheticStacks.frame( 64, 64, 0, 0 );

		final RandomAccess< FloatType > raAligned = aligned.randomAccess();
		final RandomAccess< FloatType > raRef = reference.randomAccess();
		for(int f=0;f<3;f++)
			for(int y=10;y<54;y++)
				for(int x=10;x<54;x++)
				{
					raAligned.setPosition( new int [] {x, y, f} );
					raRef.setPosition( new int [] {x, y} );
					assertEquals( raRef.get().get(), raAligned.get().get(), 1e-3f );
				}
	}

	@Test
	public void fractionalShiftIsInterpolated()
	{
		final Img< FloatType > frame = SyntheticStacks.frame( 32, 32, 0, 0 );
		final RandomAccessibleInterval< FloatType > moved = StackTransformer.alignFrame( frame, 0.0, -0.5 );
		final RandomAccess< FloatType > raMoved = moved.randomAccess();
		final RandomAccess< FloatType > raFrame = Views.extendZero( frame ).randomAccess();
		raMoved.setPosition( new int [] {16, 16} );
		raFrame.setPosition( new int [] {15, 16} );
		final float fLeft = raFrame.get().get();
		raFrame.setPosition( new int [] {16, 16} );
		final float fRight = raFrame.get().get();
		assertEquals( 0.5f*(fLeft + fRight), raMoved.get().get(), 1e-3f );
	}
}
