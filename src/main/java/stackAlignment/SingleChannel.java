package stackAlignment;

public class SingleChannel implements ChannelCombiner {

	public final int nChannel;

	public SingleChannel(final int nChannel_)
	{
		nChannel = nChannel_;
	}

	@Override
	public int [] getChannels()
	{
		return new int [] {nChannel};
	}

	@Override
	public MaskedImage combine(final MaskedImage slab)
	{
		return slab.hyperSlice( 3, 0 );
	}

	@Override
	public String toString()
	{
		return "channel " + nChannel;
	}
}
