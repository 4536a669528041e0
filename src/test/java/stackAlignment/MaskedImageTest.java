package stackAlignment;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.numeric.real.FloatType;

public class MaskedImageTest {

	/** 2x1 pixels, 3 samples along the last axis **/
	static MaskedImage samples(final float... fValues)
	{
		final Img< FloatType > img = ArrayImgs.floats( fValues, 2, 1, fValues.length/2 );
		return MaskedImage.fromReal( img );
	}

	@Test
	public void nanBecomesMissing()
	{
		final MaskedImage img = samples( 1.0f, Float.NaN, 2.0f, 3.0f );
		assertFalse( img.isMissing( 0, 0, 0 ) );
		assertTrue( img.isMissing( 1, 0, 0 ) );
		assertTrue( Double.isNaN( img.getValue( 1, 0, 0 ) ) );
		assertEquals( 3, img.countValid() );
	}

	@Test
	public void sumIgnoresMissingSamples()
	{
		final MaskedImage sum = samples( 1.0f, Float.NaN, 2.0f, 3.0f, Float.NaN, 4.0f ).sumAlong( 2 );
		assertEquals( 3.0, sum.getValue( 0, 0 ), 0.0 );
		assertEquals( 2, sum.getCount( 0, 0 ) );
		assertEquals( 7.0, sum.getValue( 1, 0 ), 0.0 );
		assertEquals( 2, sum.getCount( 1, 0 ) );
	}

	@Test
	public void allMissingStaysMissing()
	{
		final MaskedImage sum = samples( Float.NaN, 1.0f, Float.NaN, 2.0f ).sumAlong( 2 );
		assertTrue( sum.isMissing( 0, 0 ) );
		assertTrue( Double.isNaN( sum.getValue( 0, 0 ) ) );
		assertEquals( 3.0, sum.getValue( 1, 0 ), 0.0 );
	}

	@Test
	public void subtractUndoesAdd()
	{
		final MaskedImage a = samples( 1.0f, 2.0f );
		final MaskedImage b = samples( Float.NaN, 5.0f );
		final MaskedImage sum = a.copy();
		sum.add( b );
		assertEquals( 7.0, sum.getValue( 1, 0, 0 ), 0.0 );
		sum.subtract( b );
		assertEquals( 1.0, sum.getValue( 0, 0, 0 ), 0.0 );
		assertEquals( 2.0, sum.getValue( 1, 0, 0 ), 0.0 );
		assertEquals( 1, sum.getCount( 1, 0, 0 ) );
		sum.subtract( a );
		assertTrue( sum.isMissing( 0, 0, 0 ) );
		assertEquals( 0.0, sum.values.randomAccess().get().get(), 0.0 );
	}

	@Test(expected = IllegalArgumentException.class)
	public void sizeMismatchIsRejected()
	{
		samples( 1.0f, 2.0f ).add( MaskedImage.create( 3, 1, 1 ) );
	}
}
