package stackAlignment;

import java.util.Arrays;

/** Sums selected channels ignoring missing samples,
 * a pixel without any valid channel stays missing. **/
public class SummedChannels implements ChannelCombiner {

	final int [] nChannels;

	public SummedChannels(final int... nChannels_)
	{
		if(nChannels_ == null || nChannels_.length == 0)
		{
			throw new AlignmentConfigurationException("SummedChannels: at least one channel should be selected.");
		}
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
		return slab.sumAlong( 3 );
	}

	@Override
	public String toString()
	{
		return "sum of channels " + Arrays.toString( nChannels );
	}
}
