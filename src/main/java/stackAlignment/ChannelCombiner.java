package stackAlignment;

/** Strategy that combines selected channels of a frame slab into a single image per frame **/
public interface ChannelCombiner {

	/** 1-based channel indices that need to be read from the stack **/
	int [] getChannels();

	/** reduces slab [X,Y,W,C] (channels in the order of {@link #getChannels()}) to [X,Y,W] **/
	MaskedImage combine(MaskedImage slab);

	/** one channel, used as is **/
	static ChannelCombiner single(final int nChannel)
	{
		return new SingleChannel(nChannel);
	}

	/** sum over channels ignoring missing samples **/
	static ChannelCombiner summed(final int... nChannels)
	{
		return new SummedChannels(nChannels);
	}

	static ChannelCombiner custom(final ChannelReduction reduction, final int... nChannels)
	{
		return new CustomReducer(reduction, nChannels);
	}

	/** single channel for one index, sum for several **/
	static ChannelCombiner of(final int... nChannels)
	{
		if(nChannels.length == 1)
		{
			return single(nChannels[0]);
		}
		return summed(nChannels);
	}
}
