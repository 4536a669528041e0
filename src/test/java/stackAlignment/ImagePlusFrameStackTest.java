package stackAlignment;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import org.junit.Test;

import ij.ImagePlus;
import ij.ImageStack;
import ij.process.ByteProcessor;
import ij.process.ShortProcessor;
import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.real.FloatType;

public class ImagePlusFrameStackTest {

	/** 16-bit hyperstack 3x2 pixels, 2 channels, nFrames time points, value = 1000*c + 100*t + y*3 + x **/
	static ImagePlus hyperstack(final int nFrames)
	{
		final ImageStack ims = new ImageStack(3, 2);
		for(int t=1;t<=nFrames;t++)
			for(int c=1;c<=2;c++)
			{
				final short [] pixels = new short [6];
				for(int i=0;i<6;i++)
				{
					pixels[i] = (short)(1000*c + 100*t + i);
				}
				ims.addSlice( "c" + c + "t" + t, new ShortProcessor(3, 2, pixels, null) );
			}
		final ImagePlus imp = new ImagePlus("hyperstack", ims);
		imp.setDimensions( 2, 1, nFrames );
		return imp;
	}

	static float value(final RandomAccessibleInterval< FloatType > img, final int... pos)
	{
		final RandomAccess< FloatType > ra = img.randomAccess();
		ra.setPosition( pos );
		return ra.get().get();
	}

	@Test
	public void timePointsAreFrames()
	{
		final ImagePlusFrameStack stack = new ImagePlusFrameStack(hyperstack( 4 ));
		assertEquals( 3, stack.getWidth() );
		assertEquals( 2, stack.getHeight() );
		assertEquals( 4, stack.getNFrames() );
		assertEquals( 2, stack.getNChannels() );
		final RandomAccessibleInterval< FloatType > out = stack.readFrames( new int [] {3, 4}, new int [] {2, 1} );
		assertEquals( 2300.0f, value( out, 0, 0, 0, 0 ), 0.0f );
		assertEquals( 2405.0f, value( out, 2, 1, 1, 0 ), 0.0f );
		assertEquals( 1304.0f, value( out, 1, 1, 0, 1 ), 0.0f );
	}

	@Test
	public void slicesAreFramesWithoutTimeAxis()
	{
		final ImageStack ims = new ImageStack(2, 1);
		for(int z=1;z<=3;z++)
		{
			ims.addSlice( new ByteProcessor(2, 1, new byte [] {(byte) z, (byte) 200}) );
		}
		final ImagePlusFrameStack stack = new ImagePlusFrameStack(new ImagePlus("slices", ims));
		assertEquals( 3, stack.getNFrames() );
		assertEquals( 1, stack.getNChannels() );
		final RandomAccessibleInterval< FloatType > out = stack.readFrames( new int [] {2}, new int [] {1} );
		assertEquals( 2.0f, value( out, 0, 0, 0, 0 ), 0.0f );
		assertEquals( 200.0f, value( out, 1, 0, 0, 0 ), 0.0f );
	}

	@Test
	public void blankImageIsSubtracted()
	{
		final ImagePlusFrameStack stack = new ImagePlusFrameStack(hyperstack( 2 ), hyperstack( 2 ));
		stack.setNormalisation( BlankNormalisation.SUBTRACT );
		assertEquals( 0.0f, value( stack.readFrames( new int [] {2}, new int [] {1} ), 1, 1, 0, 0 ), 0.0f );
	}

	@Test
	public void alignmentOfImagePlus()
	{
		final ImageStack ims = new ImageStack(64, 64);
		final double [][] shifts = new double [][] {{0, 0}, {2, -1}, {-3, 4}};
		for(final double [] shift : shifts)
		{
			final float [] pixels = new float [64*64];
			for(int y=0;y<64;y++)
				for(int x=0;x<64;x++)
					pixels[y*64 + x] = (float) SyntheticStacks.pattern( x, y, 64, 64, shift[0], shift[1] );
			ims.addSlice( new ij.process.FloatProcessor(64, 64, pixels) );
		}
		final ImagePlus imp = new ImagePlus("drift", ims);
		imp.setDimensions( 1, 1, 3 );
		final FrameOffsets offsets = StackAligner.computeStackAlignment( new ImagePlusFrameStack(imp), new AlignmentParameters() );
		for(int f=0;f<3;f++)
		{
			assertEquals( shifts[f][0], offsets.getVerticalShift( f+1 ), 1e-12 );
			assertEquals( shifts[f][1], offsets.getHorizontalShift( f+1 ), 1e-12 );
		}
	}

	@Test(expected = IllegalArgumentException.class)
	public void rgbIsRejected()
	{
		new ImagePlusFrameStack(new ImagePlus("rgb", new ij.process.ColorProcessor(4, 4)));
	}

	@Test
	public void zAndTAxesTogetherAreRejected()
	{
		final ImageStack ims = new ImageStack(2, 2);
		for(int i=0;i<6;i++)
		{
			ims.addSlice( new ByteProcessor(2, 2) );
		}
		final ImagePlus imp = new ImagePlus("zt", ims);
		imp.setDimensions( 1, 3, 2 );
		try
		{
			new ImagePlusFrameStack(imp);
			fail( "stack with both Z and T was accepted" );
		}
		catch(IllegalArgumentException e)
		{
			assertTrue( e.getMessage().contains( "Z=3, T=2" ) );
		}
	}
}
