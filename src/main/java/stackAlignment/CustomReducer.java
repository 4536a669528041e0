package stackAlignment;

import java.util.Arrays;

/** Applies a user supplied {@link ChannelReduction}, only the shape of its output is checked **/
public class CustomReducer implements ChannelCombiner {

	final ChannelReduction reduction;

	final int [] nChannels;

	public CustomReducer(final ChannelReduction reduction_, final int... nChannels_)
	{
		if(reduction_ == null)
		{
			throw new AlignmentConfigurationException("CustomReducer: reduction function is not provided.");
		}
		if(nChannels_ == null || nChannels_.length == 0)
		{
			throw new AlignmentConfigurationException("CustomReducer: at least one channel should be selected.");
		}
		reduction = reduction_;
		nChannels = nChannels_.clone();
	}

	@Override
	public int [] getChannels()
	{
		return nChannels.clone();
	}

	@Override
	public MaskedImage combine(final MaskedImage slab)
	{
		final MaskedImage out = reduction.reduce( slab );
		if(out == null || out.numDimensions() != 3
				|| out.dimension( 0 ) != slab.dimension( 0 )
				|| out.dimension( 1 ) != slab.dimension( 1 )
				|| out.dimension( 2 ) != slab.dimension( 2 ))
		{
			throw new IllegalStateException("CustomReducer: reduction should return image of size "
					+ slab.dimension( 0 ) + "x" + slab.dimension( 1 ) + "x" + slab.dimension( 2 )
					+ ", got " + (out == null ? "null" : MiscUtils.getDimensionsText( out.values )) + ".");
		}
		return out;
	}

	@Override
	public String toString()
	{
		return "custom reduction of channels " + Arrays.toString( nChannels );
	}
}
