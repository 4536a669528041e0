package stackAlignment;

import net.imglib2.Cursor;
import net.imglib2.RandomAccess;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.loops.LoopBuilder;
import net.imglib2.type.numeric.RealType;
import net.imglib2.type.numeric.integer.IntType;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.util.Intervals;
import net.imglib2.view.Views;

/** Image with explicit missing data, stored as a pair of images:
 * a sum of valid sample values and a number of valid samples per pixel.
 * A pixel with zero count is missing, its value sum is always zero.
 * Sums of masked images therefore ignore missing samples and
 * a pixel stays missing only when none of the summed images had it. **/
public class MaskedImage {

	/** sum of valid sample values per pixel **/
	public final RandomAccessibleInterval< DoubleType > values;

	/** number of valid samples per pixel, 0 means missing **/
	public final RandomAccessibleInterval< IntType > counts;

	public MaskedImage(final RandomAccessibleInterval< DoubleType > values_, final RandomAccessibleInterval< IntType > counts_)
	{
		if(!Intervals.equalDimensions( values_, counts_ ))
		{
			throw new IllegalArgumentException("MaskedImage: values and counts must have the same dimensions.");
		}
		values = Views.zeroMin( values_ );
		counts = Views.zeroMin( counts_ );
	}

	/** creates an empty image where all pixels are missing **/
	public static MaskedImage create(final long... dims)
	{
		return new MaskedImage(ArrayImgs.doubles( dims ), ArrayImgs.ints( dims ));
	}

	/** converts a real valued image, NaN samples become missing pixels **/
	public static < T extends RealType< T > > MaskedImage fromReal(final RandomAccessibleInterval< T > img)
	{
		final MaskedImage out = create(img.dimensionsAsLongArray());
		LoopBuilder.setImages( Views.zeroMin( img ), out.values, out.counts ).forEachPixel(
				(s, v, c)->
				{
					final double dVal = s.getRealDouble();
					if(Double.isNaN( dVal ))
					{
						v.setZero();
						c.setZero();
					}
					else
					{
						v.set( dVal );
						c.set( 1 );
					}
				});
		return out;
	}

	public int numDimensions()
	{
		return values.numDimensions();
	}

	public long dimension(final int d)
	{
		return values.dimension( d );
	}

	public long [] dimensionsAsLongArray()
	{
		return values.dimensionsAsLongArray();
	}

	/** view (not a copy) of the hyperplane at position nPos along dimension d **/
	public MaskedImage hyperSlice(final int d, final long nPos)
	{
		return new MaskedImage(Views.hyperSlice( values, d, nPos ), Views.hyperSlice( counts, d, nPos ));
	}

	public MaskedImage copy()
	{
		final MaskedImage out = create(dimensionsAsLongArray());
		out.set( this );
		return out;
	}

	/** overwrites content of this image with the other one **/
	public void set(final MaskedImage other)
	{
		checkSize(other);
		LoopBuilder.setImages( values, counts, other.values, other.counts ).forEachPixel(
				(v, c, ov, oc)->
				{
					v.set( ov );
					c.set( oc );
				});
	}

	/** adds valid samples of the other image **/
	public void add(final MaskedImage other)
	{
		checkSize(other);
		LoopBuilder.setImages( values, counts, other.values, other.counts ).forEachPixel(
				(v, c, ov, oc)->
				{
					v.add( ov );
					c.add( oc );
				});
	}

	/** removes samples of the other image, previously added with {@link #add(MaskedImage)} **/
	public void subtract(final MaskedImage other)
	{
		checkSize(other);
		LoopBuilder.setImages( values, counts, other.values, other.counts ).forEachPixel(
				(v, c, ov, oc)->
				{
					v.sub( ov );
					c.sub( oc );
					if(c.get() == 0)
					{
						v.setZero();
					}
				});
	}

	/** sums the image along dimension d, ignoring missing samples.
	 * The output has one dimension less. **/
	public MaskedImage sumAlong(final int d)
	{
		final long [] dims = dimensionsAsLongArray();
		final long [] dimsOut = new long [dims.length - 1];
		int i, j = 0;
		for(i=0;i<dims.length;i++)
		{
			if(i!=d)
			{
				dimsOut[j] = dims[i];
				j++;
			}
		}
		final MaskedImage out = create(dimsOut);
		for(long nPos=0;nPos<dims[d];nPos++)
		{
			out.add( hyperSlice(d, nPos) );
		}
		return out;
	}

	public boolean isMissing(final long... pos)
	{
		final RandomAccess< IntType > ra = counts.randomAccess();
		ra.setPosition( pos );
		return ra.get().get() == 0;
	}

	/** returns sum of valid samples at the position or NaN if the pixel is missing **/
	public double getValue(final long... pos)
	{
		if(isMissing(pos))
			return Double.NaN;
		final RandomAccess< DoubleType > ra = values.randomAccess();
		ra.setPosition( pos );
		return ra.get().get();
	}

	public int getCount(final long... pos)
	{
		final RandomAccess< IntType > ra = counts.randomAccess();
		ra.setPosition( pos );
		return ra.get().get();
	}

	/** number of pixels that are not missing **/
	public long countValid()
	{
		long nValid = 0;
		final Cursor< IntType > cursor = Views.flatIterable( counts ).cursor();
		while(cursor.hasNext())
		{
			if(cursor.next().get() > 0)
				nValid++;
		}
		return nValid;
	}

	private void checkSize(final MaskedImage other)
	{
		if(!Intervals.equalDimensions( values, other.values ))
		{
			throw new IllegalArgumentException("MaskedImage: image dimensions "+MiscUtils.getDimensionsText( values )
										+" and " + MiscUtils.getDimensionsText( other.values ) + " do not match.");
		}
	}
}
