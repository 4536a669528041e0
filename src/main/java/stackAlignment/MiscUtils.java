package stackAlignment;

import ij.IJ;
import net.imglib2.Dimensions;

public class MiscUtils {

	/** returns lag corresponding to the index of unshifted (zero first) FFT grid:
	 * indices at or beyond the half of the size denote negative lags **/
	public static int wrapLag(final int nIndex, final int nSize)
	{
		if(nIndex >= nSize/2 && nSize>1)
		{
			return nIndex - nSize;
		}
		return nIndex;
	}

	/** frequency (in cycles/pixel) of the index in the unshifted FFT grid of size nSize **/
	public static double indexFrequency(final int nIndex, final int nSize)
	{
		final int nHalf = nSize/2;
		return ((double)(((nIndex + nHalf) % nSize) - nHalf))/nSize;
	}

	/** returns true if candidate is better peak than current (by magnitude and then by distance to zero shift) **/
	public static boolean isBetterPeak(final double dCandMag, final double dCandDist, final double dBestMag, final double dBestDist)
	{
		if(dCandMag > dBestMag)
			return true;
		if(dCandMag == dBestMag && dCandDist < dBestDist)
			return true;
		return false;
	}

	/** returns -0.0 as 0.0 **/
	public static double noNegativeZero(final double dVal)
	{
		return dVal + 0.0;
	}

	public static String getDimensionsText(final Dimensions dims)
	{
		final StringBuilder sb = new StringBuilder();
		for(int d=0;d<dims.numDimensions();d++)
		{
			if(d>0)
				sb.append( "x" );
			sb.append( dims.dimension( d ) );
		}
		return sb.toString();
	}

	/** logs the message if verbose and returns the exception to be thrown **/
	public static < E extends RuntimeException > E logError(final E exception, final boolean bVerbose)
	{
		if(bVerbose)
		{
			IJ.log( "Error! " + exception.getMessage() );
		}
		return exception;
	}
}
