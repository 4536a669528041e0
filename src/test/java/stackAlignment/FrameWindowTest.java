package stackAlignment;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Random;

import org.junit.Test;

import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.real.FloatType;
import net.imglib2.view.Views;

public class FrameWindowTest {

	/** random 4x3 frames, some samples missing **/
	static Img< FloatType > randomFrames(final int nFrames, final long nSeed)
	{
		final Random rnd = new Random(nSeed);
		final float [] data = new float [4*3*nFrames];
		for(int i=0;i<data.length;i++)
		{
			data[i] = rnd.nextInt( 10 ) == 0 ? Float.NaN : rnd.nextFloat()*1000.0f;
		}
		return ArrayImgs.floats( data, 4, 3, nFrames );
	}

	static void assertSumOfFrames(final MaskedImage frames, final int nFrom, final int nLength, final MaskedImage actual)
	{
		final MaskedImage expected = new MaskedImage(Views.interval( frames.values, new long [] {0, 0, nFrom}, new long [] {3, 2, nFrom + nLength - 1} ),
				Views.interval( frames.counts, new long [] {0, 0, nFrom}, new long [] {3, 2, nFrom + nLength - 1} )).sumAlong( 2 );
		for(int y=0;y<3;y++)
			for(int x=0;x<4;x++)
			{
				assertEquals( expected.getCount( x, y ), actual.getCount( x, y ) );
				if(expected.getCount( x, y ) == 0)
				{
					assertTrue( actual.isMissing( x, y ) );
				}
				else
				{
					assertEquals( expected.getValue( x, y ), actual.getValue( x, y ), 1e-6 );
				}
			}
	}

	@Test
	public void runningSumEqualsDirectSum()
	{
		final int nLength = 3;
		final MaskedImage frames = MaskedImage.fromReal( randomFrames( 20, 1L ) );
		final FrameWindow window = new FrameWindow(nLength);
		window.initialize( new MaskedImage(Views.interval( frames.values, new long [] {0, 0, 0}, new long [] {3, 2, nLength - 1} ),
				Views.interval( frames.counts, new long [] {0, 0, 0}, new long [] {3, 2, nLength - 1} )) );
		assertSumOfFrames( frames, 0, nLength, window.currentSum() );
		for(int f=nLength;f<20;f++)
		{
			final MaskedImage sum = window.advance( frames.hyperSlice( 2, f ) );
			assertSumOfFrames( frames, f - nLength + 1, nLength, sum );
		}
	}

	@Test
	public void windowOfOneIsTheFrame()
	{
		final MaskedImage frames = MaskedImage.fromReal( randomFrames( 5, 2L ) );
		final FrameWindow window = new FrameWindow(1);
		window.initialize( new MaskedImage(Views.interval( frames.values, new long [] {0, 0, 0}, new long [] {3, 2, 0} ),
				Views.interval( frames.counts, new long [] {0, 0, 0}, new long [] {3, 2, 0} )) );
		for(int f=1;f<5;f++)
		{
			assertSumOfFrames( frames, f, 1, window.advance( frames.hyperSlice( 2, f ) ) );
		}
	}

	@Test
	public void offsetsFollowWindowLength()
	{
		assertEquals( 0, AlignmentParameters.windowOffsets( 1 )[0] );
		assertEquals( 0, AlignmentParameters.windowOffsets( 1 )[1] );
		assertEquals( -1, AlignmentParameters.windowOffsets( 4 )[0] );
		assertEquals( 2, AlignmentParameters.windowOffsets( 4 )[1] );
		assertEquals( -3, AlignmentParameters.windowOffsets( 7 )[0] );
		assertEquals( 3, AlignmentParameters.windowOffsets( 7 )[1] );
	}

	@Test(expected = AlignmentConfigurationException.class)
	public void zeroLengthIsRejected()
	{
		new FrameWindow(0);
	}

	@Test(expected = IllegalStateException.class)
	public void advanceBeforeInitializeFails()
	{
		new FrameWindow(2).advance( MaskedImage.create( 4, 3 ) );
	}
}
