package stackAlignment;

import net.imglib2.Cursor;
import net.imglib2.RandomAccess;
import net.imglib2.img.Img;
import net.imglib2.img.array.ArrayImgs;
import net.imglib2.type.logic.BitType;

/** Binary radial band-pass mask over unshifted (zero frequency first) frequency grid.
 * Frequency r = sqrt(kx^2+ky^2) in cycles/pixel passes if dMinFreq <= r <= dMaxFreq. **/
public class BandPassFilter {

	public final int nWidth;

	public final int nHeight;

	/** lower cutoff, cycles/pixel **/
	public final double dMinFreq;

	/** upper cutoff, cycles/pixel **/
	public final double dMaxFreq;

	final Img< BitType > mask;

	/** builds the mask, the cutoff pair is sorted first **/
	public BandPassFilter(final int nWidth_, final int nHeight_, final double dCutoff1, final double dCutoff2)
	{
		nWidth = nWidth_;
		nHeight = nHeight_;
		dMinFreq = Math.min( dCutoff1, dCutoff2 );
		dMaxFreq = Math.max( dCutoff1, dCutoff2 );
		mask = ArrayImgs.bits( nWidth, nHeight );

		final Cursor< BitType > cursor = mask.localizingCursor();
		double dFx, dFy, dR;
		while(cursor.hasNext())
		{
			cursor.fwd();
			dFx = MiscUtils.indexFrequency( cursor.getIntPosition( 0 ), nWidth );
			dFy = MiscUtils.indexFrequency( cursor.getIntPosition( 1 ), nHeight );
			dR = Math.sqrt( dFx*dFx + dFy*dFy );
			// all false, true above lower cutoff, false again above upper cutoff
			boolean bPass = false;
			if(dR >= dMinFreq)
				bPass = true;
			if(dR > dMaxFreq)
				bPass = false;
			cursor.get().set( bPass );
		}
	}

	/** frequencies (cycles/pixel) of unshifted FFT grid of size n **/
	public static double [] frequencies(final int n)
	{
		final double [] freq = new double [n];
		for(int i=0;i<n;i++)
		{
			freq[i] = MiscUtils.indexFrequency( i, n );
		}
		return freq;
	}

	public boolean passes(final int x, final int y)
	{
		final RandomAccess< BitType > ra = mask.randomAccess();
		ra.setPosition( new int [] {x, y} );
		return ra.get().get();
	}

	public long countPassing()
	{
		long nCount = 0;
		for(final BitType b : mask)
		{
			if(b.get())
				nCount++;
		}
		return nCount;
	}

	/** zeroes all frequencies of the spectrum outside of the band **/
	public void apply(final Spectrum spectrum)
	{
		if(spectrum.nWidth != nWidth || spectrum.nHeight != nHeight)
		{
			throw new IllegalArgumentException("BandPassFilter: mask size " + nWidth + "x" + nHeight
					+ " does not match spectrum size " + spectrum.nWidth + "x" + spectrum.nHeight + ".");
		}
		final Cursor< BitType > cursor = mask.localizingCursor();
		int nInd;
		while(cursor.hasNext())
		{
			if(!cursor.next().get())
			{
				nInd = cursor.getIntPosition( 1 )*nWidth + cursor.getIntPosition( 0 );
				spectrum.data[2*nInd] = 0.0;
				spectrum.data[2*nInd+1] = 0.0;
			}
		}
	}
}
