package stackAlignment;

import java.util.ArrayList;
import java.util.List;

import ij.Prefs;

/** Parameters of stack alignment, defaults correspond to
 * registration of channel 1 against the first frame, integer precision, no averaging. **/
public class AlignmentParameters {

	/** key prefix in ImageJ Prefs **/
	public static final String PREFS_PREFIX = "StackAlignment.";

	/** which channels are used and how they are combined **/
	public ChannelCombiner channelCombiner = ChannelCombiner.single( 1 );

	/** register each frame to the previous one and accumulate offsets **/
	public boolean bProgressive = false;

	/** precision of the shift is 1/nUpsampling pixels **/
	public int nUpsampling = 1;

	public AlignmentReference reference = AlignmentReference.none();

	/** number of consecutive frames summed before registration **/
	public int nWindowLength = 1;

	/** band-pass cutoffs, cycles/pixel (sorted before use) **/
	public double [] dSpatFreqCutoff = new double [] {0.0, Double.POSITIVE_INFINITY};

	/** independent blocks of frames, null means one block over the whole stack **/
	public List< TrialRange > trialRanges = null;

	/** frames before the first registered frame of a block get both offsets of that frame
	 * (by default only the vertical one) **/
	public boolean bSymmetricEdgeExtension = false;

	/** checks parameters that do not depend on the stack **/
	public void validate()
	{
		if(channelCombiner == null)
		{
			throw new AlignmentConfigurationException("AlignmentParameters: channel combiner is not specified.");
		}
		if(nWindowLength < 1)
		{
			throw new AlignmentConfigurationException("AlignmentParameters: window length should be at least 1, provided " + nWindowLength + ".");
		}
		if(nUpsampling < 1)
		{
			throw new AlignmentConfigurationException("AlignmentParameters: upsampling factor should be at least 1, provided " + nUpsampling + ".");
		}
		if(dSpatFreqCutoff == null || dSpatFreqCutoff.length != 2)
		{
			throw new AlignmentConfigurationException("AlignmentParameters: spatial frequency cutoff should be a pair of values.");
		}
		for(final double dCut : dSpatFreqCutoff)
		{
			if(Double.isNaN( dCut ) || dCut < 0.0)
			{
				throw new AlignmentConfigurationException("AlignmentParameters: spatial frequency cutoff should be non-negative, provided " + dCut + ".");
			}
		}
		if(reference == null)
		{
			throw new AlignmentConfigurationException("AlignmentParameters: reference is null, use AlignmentReference.none().");
		}
		if(!reference.isNone() && bProgressive)
		{
			throw new AlignmentConfigurationException("AlignmentParameters: reference (" + reference
								+ ") cannot be used together with progressive registration.");
		}
	}

	/** minimum (non-positive) and maximum (non-negative) frame offsets of the window **/
	public int [] windowOffsets()
	{
		return windowOffsets( nWindowLength );
	}

	/** offsets ceil(-(L-1)/2) ... floor(L/2) **/
	public static int [] windowOffsets(final int nLength)
	{
		return new int [] {-((nLength - 1)/2), nLength/2};
	}

	/** cutoffs in increasing order **/
	public double [] sortedCutoff()
	{
		return new double [] {Math.min( dSpatFreqCutoff[0], dSpatFreqCutoff[1] ), Math.max( dSpatFreqCutoff[0], dSpatFreqCutoff[1] )};
	}

	/** stores parameters in ImageJ Prefs. Custom reductions and reference images are not stored. **/
	public void saveToPrefs()
	{
		final int [] nChannels = channelCombiner.getChannels();
		final StringBuilder sb = new StringBuilder();
		for(int i=0;i<nChannels.length;i++)
		{
			if(i>0)
				sb.append( "," );
			sb.append( nChannels[i] );
		}
		Prefs.set( PREFS_PREFIX + "sChannels", sb.toString() );
		Prefs.set( PREFS_PREFIX + "bProgressive", bProgressive );
		Prefs.set( PREFS_PREFIX + "nUpsampling", nUpsampling );
		Prefs.set( PREFS_PREFIX + "nWindowLength", nWindowLength );
		Prefs.set( PREFS_PREFIX + "dSpatFreqCutoffMin", Double.toString( dSpatFreqCutoff[0] ) );
		Prefs.set( PREFS_PREFIX + "dSpatFreqCutoffMax", Double.toString( dSpatFreqCutoff[1] ) );
		Prefs.set( PREFS_PREFIX + "sTrialRanges", TrialRange.format( trialRanges ) );
		Prefs.set( PREFS_PREFIX + "nReferenceFrame", reference.kind == AlignmentReference.Kind.FRAME ? reference.nFrame : 0 );
		Prefs.set( PREFS_PREFIX + "bSymmetricEdgeExtension", bSymmetricEdgeExtension );
	}

	/** loads parameters stored by {@link #saveToPrefs()}, missing values get defaults **/
	public static AlignmentParameters loadFromPrefs()
	{
		final AlignmentParameters params = new AlignmentParameters();
		final String sChannels = Prefs.get( PREFS_PREFIX + "sChannels", "1" );
		final List< Integer > channels = new ArrayList<>();
		try
		{
			for(final String sCh : sChannels.split( "," ))
			{
				if(!sCh.trim().isEmpty())
					channels.add( Integer.parseInt( sCh.trim() ) );
			}
			params.dSpatFreqCutoff = new double [] {
					Double.parseDouble( Prefs.get( PREFS_PREFIX + "dSpatFreqCutoffMin", "0.0" ) ),
					Double.parseDouble( Prefs.get( PREFS_PREFIX + "dSpatFreqCutoffMax", "Infinity" ) )};
		}
		catch(NumberFormatException e)
		{
			throw new AlignmentConfigurationException("AlignmentParameters: stored preferences cannot be parsed (" + e.getMessage() + ").");
		}
		if(channels.isEmpty())
		{
			channels.add( 1 );
		}
		final int [] nChannels = new int [channels.size()];
		for(int i=0;i<nChannels.length;i++)
		{
			nChannels[i] = channels.get( i );
		}
		params.channelCombiner = ChannelCombiner.of( nChannels );
		params.bProgressive = Prefs.get( PREFS_PREFIX + "bProgressive", false );
		params.nUpsampling = (int) Prefs.get( PREFS_PREFIX + "nUpsampling", 1 );
		params.nWindowLength = (int) Prefs.get( PREFS_PREFIX + "nWindowLength", 1 );
		final List< TrialRange > trials = TrialRange.parse( Prefs.get( PREFS_PREFIX + "sTrialRanges", "" ) );
		params.trialRanges = trials.isEmpty() ? null : trials;
		final int nRefFrame = (int) Prefs.get( PREFS_PREFIX + "nReferenceFrame", 0 );
		params.reference = nRefFrame > 0 ? AlignmentReference.frame( nRefFrame ) : AlignmentReference.none();
		params.bSymmetricEdgeExtension = Prefs.get( PREFS_PREFIX + "bSymmetricEdgeExtension", false );
		return params;
	}

	@Override
	public String toString()
	{
		return "channels: " + channelCombiner + ", progressive: " + bProgressive + ", upsampling: " + nUpsampling
				+ ", reference: " + reference + ", window: " + nWindowLength
				+ ", cutoff: " + dSpatFreqCutoff[0] + "-" + dSpatFreqCutoff[1] + " cycles/px"
				+ ", trials: " + (trialRanges == null ? "whole stack" : TrialRange.format( trialRanges ));
	}
}
