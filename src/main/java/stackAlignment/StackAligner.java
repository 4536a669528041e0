package stackAlignment;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import ij.IJ;
import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.real.FloatType;

/** Estimates rigid XY offsets of every frame of a time-lapse stack.
 * Frames (optionally summed over a sliding window and over several channels)
 * are band-pass filtered and registered by phase correlation to a reference,
 * each trial block independently. **/
public class StackAligner {

	/** log progress and results with IJ.log **/
	public boolean bVerbose = false;

	/** frames read from the stack so far, for reporting **/
	long nFramesRead = 0;

	/** computes offsets with default (silent) aligner **/
	public static FrameOffsets computeStackAlignment(final FrameStack stack, final AlignmentParameters params)
	{
		return new StackAligner().align( stack, params );
	}

	/**
	 * Computes frame offsets of the stack.
	 * All parameters are checked before any frame is registered,
	 * blank normalisation of the stack is switched off during the call and restored afterwards.
	 * @return offsets of all frames, frames outside of trial blocks get zero offset
	 */
	public FrameOffsets align(final FrameStack stack, final AlignmentParameters params)
	{
		final List< TrialRange > trials = checkParameters( stack, params );
		final int nFrames = stack.getNFrames();
		final int [] nWinOff = params.windowOffsets();
		final double [] dCutoff = params.sortedCutoff();
		final BandPassFilter filter = new BandPassFilter((int) stack.getWidth(), (int) stack.getHeight(), dCutoff[0], dCutoff[1]);

		if(bVerbose)
		{
			IJ.log("Stack alignment: " + stack.getWidth() + "x" + stack.getHeight() + " pixels, " + nFrames + " frames, "
						+ trials.size() + " trial block(s).");
			IJ.log("Parameters: " + params.toString());
			IJ.log(filter.countPassing() + " of " + (filter.nWidth*(long)filter.nHeight) + " frequencies pass the band-pass filter.");
		}

		final FrameOffsets offsets = new FrameOffsets(nFrames);
		nFramesRead = 0;
		final long nStartTime = System.currentTimeMillis();

		try (NormalisationOverride normOverride = new NormalisationOverride(stack, BlankNormalisation.NONE))
		{
			Spectrum refSpectrum = resolveReference( stack, params, filter );
			final FrameWindow window = new FrameWindow(params.nWindowLength);
			int nTotalInner = 0;
			for(final TrialRange trial : trials)
			{
				nTotalInner += trial.length() - params.nWindowLength + 1;
			}
			int nDone = 0;

			for(int nTrial=0;nTrial<trials.size();nTrial++)
			{
				final TrialRange trial = trials.get( nTrial );
				final int nFirst = trial.nStart - nWinOff[0];
				final int nLast = trial.nEnd - nWinOff[1];

				window.initialize( readCombined( stack, params.channelCombiner, nFirst + nWinOff[0], params.nWindowLength ) );
				if(refSpectrum == null)
				{
					refSpectrum = filteredSpectrum( window.currentSum(), filter );
				}

				for(int nFrame=nFirst;nFrame<=nLast;nFrame++)
				{
					final MaskedImage windowSum;
					if(nFrame == nFirst)
					{
						windowSum = window.currentSum();
					}
					else
					{
						windowSum = window.advance( readCombined( stack, params.channelCombiner, nFrame + nWinOff[1], 1 ).hyperSlice( 2, 0 ) );
					}
					final Spectrum current = filteredSpectrum( windowSum, filter );
					final RegistrationResult result = PhaseCorrelation.register( refSpectrum, current, params.nUpsampling );
					offsets.set( nFrame, result );
					if(params.bProgressive)
					{
						refSpectrum = current;
					}
					nDone++;
					if(bVerbose)
					{
						IJ.showProgress( nDone, nTotalInner );
					}
				}

				extendEdges( offsets, trial, nFirst, nLast, params.bSymmetricEdgeExtension );

				if(bVerbose)
				{
					IJ.log("Trial " + (nTrial+1) + " (frames " + trial + "): registered frames " + nFirst + "-" + nLast
								+ ", last offset Y=" + offsets.getVerticalShift( nLast ) + " X=" + offsets.getHorizontalShift( nLast )
								+ ", error " + offsets.getError( nLast ));
				}
			}
		}

		if(params.bProgressive)
		{
			offsets.accumulate();
		}
		if(bVerbose)
		{
			IJ.showProgress( 2, 2 );
			IJ.log("Stack alignment done, " + nFramesRead + " frames read in " + (System.currentTimeMillis() - nStartTime) + " ms.");
		}
		return offsets;
	}

	/** validates parameters against the stack, returns trial blocks to process **/
	List< TrialRange > checkParameters(final FrameStack stack, final AlignmentParameters params)
	{
		try
		{
			params.validate();
		}
		catch(AlignmentConfigurationException e)
		{
			throw MiscUtils.logError( e, bVerbose );
		}
		final int nFrames = stack.getNFrames();
		if(nFrames < 1)
		{
			throw MiscUtils.logError( new FrameBoundsException("StackAligner: stack has no frames."), bVerbose );
		}
		for(final int nCh : params.channelCombiner.getChannels())
		{
			if(nCh < 1 || nCh > stack.getNChannels())
			{
				throw MiscUtils.logError( new FrameBoundsException("StackAligner: channel " + nCh + " is outside of range [1, "
													+ stack.getNChannels() + "]."), bVerbose );
			}
		}
		final AlignmentReference ref = params.reference;
		if(ref.kind == AlignmentReference.Kind.IMAGE)
		{
			if(ref.image.dimension( 0 ) != stack.getWidth() || ref.image.dimension( 1 ) != stack.getHeight())
			{
				throw MiscUtils.logError( new ReferenceSizeMismatchException("StackAligner: reference image size "
								+ MiscUtils.getDimensionsText( ref.image.values ) + " differs from frame size "
								+ stack.getWidth() + "x" + stack.getHeight() + "."), bVerbose );
			}
		}
		if(ref.kind == AlignmentReference.Kind.FRAME && (ref.nFrame < 1 || ref.nFrame > nFrames))
		{
			throw MiscUtils.logError( new FrameBoundsException("StackAligner: reference frame " + ref.nFrame
								+ " is outside of range [1, " + nFrames + "]."), bVerbose );
		}

		final List< TrialRange > trials;
		if(params.trialRanges == null)
		{
			trials = Collections.singletonList( new TrialRange(1, nFrames) );
		}
		else
		{
			trials = new ArrayList<>(params.trialRanges);
			if(trials.isEmpty())
			{
				throw MiscUtils.logError( new FrameBoundsException("StackAligner: empty list of trial ranges."), bVerbose );
			}
		}
		int nPrevEnd = 0;
		for(final TrialRange trial : trials)
		{
			if(trial.nStart < 1 || trial.nEnd > nFrames || trial.nStart > trial.nEnd)
			{
				throw MiscUtils.logError( new FrameBoundsException("StackAligner: trial range " + trial
									+ " is invalid for a stack of " + nFrames + " frames."), bVerbose );
			}
			if(trial.nStart <= nPrevEnd)
			{
				throw MiscUtils.logError( new FrameBoundsException("StackAligner: trial range " + trial
									+ " overlaps or precedes the previous one."), bVerbose );
			}
			if(trial.length() < params.nWindowLength)
			{
				throw MiscUtils.logError( new FrameBoundsException("StackAligner: trial range " + trial + " is shorter than the averaging window of "
									+ params.nWindowLength + " frames."), bVerbose );
			}
			nPrevEnd = trial.nEnd;
		}
		return trials;
	}

	/** spectrum of the reference or null, if it should be taken from the first window **/
	Spectrum resolveReference(final FrameStack stack, final AlignmentParameters params, final BandPassFilter filter)
	{
		final AlignmentReference ref = params.reference;
		switch(ref.kind)
		{
			case IMAGE:
				return filteredSpectrum( ref.image, filter );
			case FRAME:
				final int [] nWinOff = params.windowOffsets();
				final int nFrom = Math.max( 1, ref.nFrame + nWinOff[0] );
				final int nTo = Math.min( stack.getNFrames(), ref.nFrame + nWinOff[1] );
				if(bVerbose)
				{
					IJ.log("Reference: sum of frames " + nFrom + "-" + nTo + ".");
				}
				return filteredSpectrum( readCombined( stack, params.channelCombiner, nFrom, nTo - nFrom + 1 ).sumAlong( 2 ), filter );
			default:
				return null;
		}
	}

	/** reads nCount consecutive frames starting from nFrom and combines channels, returns [X,Y,nCount] **/
	MaskedImage readCombined(final FrameStack stack, final ChannelCombiner combiner, final int nFrom, final int nCount)
	{
		final int [] frames = new int [nCount];
		for(int i=0;i<nCount;i++)
		{
			frames[i] = nFrom + i;
		}
		final RandomAccessibleInterval< FloatType > raw = stack.readFrames( frames, combiner.getChannels() );
		nFramesRead += nCount;
		return combiner.combine( MaskedImage.fromReal( raw ) );
	}

	static Spectrum filteredSpectrum(final MaskedImage image, final BandPassFilter filter)
	{
		final Spectrum spectrum = Spectrum.of( image );
		filter.apply( spectrum );
		return spectrum;
	}

	/** frames of the block outside of the registered range get offsets of the nearest registered frame.
	 * At the leading edge only the vertical offset is copied, unless bSymmetric is set. **/
	static void extendEdges(final FrameOffsets offsets, final TrialRange trial, final int nFirst, final int nLast, final boolean bSymmetric)
	{
		for(int nFrame=trial.nStart;nFrame<nFirst;nFrame++)
		{
			offsets.extrapolate( nFirst, nFrame, bSymmetric );
		}
		for(int nFrame=nLast+1;nFrame<=trial.nEnd;nFrame++)
		{
			offsets.extrapolate( nLast, nFrame, true );
		}
	}
}
