package stackAlignment;

import net.imglib2.Cursor;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.real.DoubleType;
import net.imglib2.util.RealSum;
import net.imglib2.view.Views;

import org.jtransforms.fft.DoubleFFT_1D;
import org.jtransforms.fft.DoubleFFT_2D;

/** Complex 2D Fourier spectrum of a frame (zero frequency first), computed
 * at the frame's own size nWidth x nHeight, so correlations wrap around.
 * Data is stored interleaved (real, imaginary) in row-major order, index = 2*(y*nWidth+x). **/
public class Spectrum {

	public final int nWidth;

	public final int nHeight;

	/** interleaved real and imaginary parts **/
	final double [] data;

	Spectrum(final int nWidth_, final int nHeight_, final double [] data_)
	{
		nWidth = nWidth_;
		nHeight = nHeight_;
		data = data_;
	}

	/** transforms a masked image (missing pixels become zero) **/
	public static Spectrum of(final MaskedImage image)
	{
		return of(image.values);
	}

	/** computes spectrum of a 2D image **/
	public static Spectrum of(final RandomAccessibleInterval< DoubleType > image)
	{
		if(image.numDimensions()!=2)
		{
			throw new IllegalArgumentException("Spectrum: image of size "+MiscUtils.getDimensionsText( image )
										+ " is not two dimensional.");
		}
		if(2L*image.dimension( 0 )*image.dimension( 1 ) > Integer.MAX_VALUE)
		{
			throw new IllegalArgumentException("Spectrum: image of size "+MiscUtils.getDimensionsText( image )
										+ " is too large.");
		}
		final int nW = (int) image.dimension( 0 );
		final int nH = (int) image.dimension( 1 );
		// realForwardFull takes the real input in the first half of the array
		final double [] data = new double [2*nW*nH];
		final Cursor< DoubleType > cursor = Views.flatIterable( Views.zeroMin( image ) ).localizingCursor();
		while(cursor.hasNext())
		{
			cursor.fwd();
			data[cursor.getIntPosition( 1 )*nW + cursor.getIntPosition( 0 )] = cursor.get().get();
		}
		transform( data, nW, nH, true );
		return new Spectrum(nW, nH, data);
	}

	/** returns this spectrum multiplied by complex conjugate of the other one **/
	public Spectrum conjugateMultiply(final Spectrum other)
	{
		if(other.nWidth != nWidth || other.nHeight != nHeight)
		{
			throw new IllegalArgumentException("Spectrum: sizes " + nWidth + "x" + nHeight + " and "
					+ other.nWidth + "x" + other.nHeight + " do not match.");
		}
		final double [] out = new double [data.length];
		double dRe1, dIm1, dRe2, dIm2;
		for(int i=0;i<data.length;i+=2)
		{
			dRe1 = data[i];
			dIm1 = data[i+1];
			dRe2 = other.data[i];
			dIm2 = other.data[i+1];
			out[i] = dRe1*dRe2 + dIm1*dIm2;
			out[i+1] = dIm1*dRe2 - dRe1*dIm2;
		}
		return new Spectrum(nWidth, nHeight, out);
	}

	/** sum of squared magnitudes over the grid **/
	public double energy()
	{
		final RealSum sum = new RealSum();
		for(int i=0;i<data.length;i++)
		{
			sum.add( data[i]*data[i] );
		}
		return sum.getSum();
	}

	/** inverse transform, returns real part as row-major array (index = y*nWidth+x) **/
	public double [] inverseReal()
	{
		final double [] complex = data.clone();
		transform( complex, nWidth, nHeight, false );
		final double [] out = new double [nWidth*nHeight];
		for(int i=0;i<out.length;i++)
		{
			out[i] = complex[2*i];
		}
		return out;
	}

	/** forward (real input in the first half of data) or scaled inverse (complex) transform in place.
	 * DoubleFFT_2D needs both sizes above 1, single row or column frames use the 1D transform. **/
	static void transform(final double [] data, final int nW, final int nH, final boolean bForward)
	{
		if(nW*nH == 1)
		{
			if(bForward)
				data[1] = 0.0;
			return;
		}
		if(nW == 1 || nH == 1)
		{
			final DoubleFFT_1D fft1D = new DoubleFFT_1D(nW*nH);
			if(bForward)
				fft1D.realForwardFull( data );
			else
				fft1D.complexInverse( data, true );
			return;
		}
		final DoubleFFT_2D fft2D = new DoubleFFT_2D(nH, nW);
		if(bForward)
			fft2D.realForwardFull( data );
		else
			fft2D.complexInverse( data, true );
	}

	public double getReal(final int x, final int y)
	{
		return data[2*(y*nWidth + x)];
	}

	public double getImaginary(final int x, final int y)
	{
		return data[2*(y*nWidth + x) + 1];
	}
}
