package stackAlignment;

import java.util.Arrays;

import ij.measure.ResultsTable;

/** Per-frame offsets of a stack (column 0 = vertical shift along Y, column 1 = horizontal shift along X)
 * with registration diagnostics. Frame indices are 1-based. **/
public class FrameOffsets {

	final double [][] dOffsets;

	final double [] dError;

	final double [] dPhase;

	final boolean [] bExtrapolated;

	final boolean [] bMeasured;

	public FrameOffsets(final int nFrames)
	{
		dOffsets = new double [nFrames][2];
		dError = new double [nFrames];
		dPhase = new double [nFrames];
		bExtrapolated = new boolean [nFrames];
		bMeasured = new boolean [nFrames];
		Arrays.fill( dError, 1.0 );
	}

	public int getNFrames()
	{
		return dOffsets.length;
	}

	public double getVerticalShift(final int nFrame)
	{
		return dOffsets[index( nFrame )][0];
	}

	public double getHorizontalShift(final int nFrame)
	{
		return dOffsets[index( nFrame )][1];
	}

	/** returns copy of {vertical, horizontal} offset **/
	public double [] getOffset(final int nFrame)
	{
		return dOffsets[index( nFrame )].clone();
	}

	/** F x 2 matrix copy **/
	public double [][] toArray()
	{
		final double [][] out = new double [dOffsets.length][];
		for(int i=0;i<dOffsets.length;i++)
		{
			out[i] = dOffsets[i].clone();
		}
		return out;
	}

	/** normalised correlation error of the registration (1 for frames not measured) **/
	public double getError(final int nFrame)
	{
		return dError[index( nFrame )];
	}

	public double getPhase(final int nFrame)
	{
		return dPhase[index( nFrame )];
	}

	/** true if the offset was copied from a neighbouring registered frame **/
	public boolean isExtrapolated(final int nFrame)
	{
		return bExtrapolated[index( nFrame )];
	}

	/** true if the frame was registered or extrapolated (belongs to a trial block) **/
	public boolean isMeasured(final int nFrame)
	{
		return bMeasured[index( nFrame )];
	}

	void set(final int nFrame, final RegistrationResult result)
	{
		final int i = index( nFrame );
		dOffsets[i][0] = result.dShiftY;
		dOffsets[i][1] = result.dShiftX;
		dError[i] = result.dError;
		dPhase[i] = result.dPhase;
		bMeasured[i] = true;
		bExtrapolated[i] = false;
	}

	/** copies offset of nFrom to nTo, only the vertical one if bBothAxes is false **/
	void extrapolate(final int nFrom, final int nTo, final boolean bBothAxes)
	{
		final int iFrom = index( nFrom );
		final int iTo = index( nTo );
		dOffsets[iTo][0] = dOffsets[iFrom][0];
		if(bBothAxes)
		{
			dOffsets[iTo][1] = dOffsets[iFrom][1];
		}
		dError[iTo] = dError[iFrom];
		dPhase[iTo] = dPhase[iFrom];
		bMeasured[iTo] = true;
		bExtrapolated[iTo] = true;
	}

	/** replaces offsets by their running cumulative sum over frames **/
	public void accumulate()
	{
		for(int i=1;i<dOffsets.length;i++)
		{
			dOffsets[i][0] += dOffsets[i-1][0];
			dOffsets[i][1] += dOffsets[i-1][1];
		}
	}

	/** offsets and diagnostics as ImageJ ResultsTable (not shown) **/
	public ResultsTable toResultsTable()
	{
		final ResultsTable rt = new ResultsTable();
		for(int i=0;i<dOffsets.length;i++)
		{
			rt.incrementCounter();
			rt.addValue( "Frame", i+1 );
			rt.addValue( "Shift_Y_px", dOffsets[i][0] );
			rt.addValue( "Shift_X_px", dOffsets[i][1] );
			rt.addValue( "Error", bMeasured[i] ? dError[i] : Double.NaN );
			rt.addValue( "Phase", bMeasured[i] ? dPhase[i] : Double.NaN );
			rt.addValue( "Extrapolated", bExtrapolated[i] ? 1 : 0 );
		}
		return rt;
	}

	int index(final int nFrame)
	{
		if(nFrame < 1 || nFrame > dOffsets.length)
		{
			throw new FrameBoundsException("FrameOffsets: frame " + nFrame + " is outside of range [1, " + dOffsets.length + "].");
		}
		return nFrame - 1;
	}
}
