package stackAlignment;

/** Sliding window over the last nLength combined frames.
 * Keeps a running masked sum (values and counts), updated by subtracting
 * the evicted frame and adding the new one. The sum is recomputed
 * from the slots every nLength updates to limit floating point drift. **/
public class FrameWindow {

	/** depth of the window **/
	public final int nLength;

	final MaskedImage [] slots;

	MaskedImage sum = null;

	/** slot to be overwritten next (the oldest one) **/
	int nOldest = 0;

	int nUpdates = 0;

	/** if the object was initialized **/
	public boolean bInit = false;

	public FrameWindow(final int nLength_)
	{
		if(nLength_ < 1)
		{
			throw new AlignmentConfigurationException("FrameWindow: window length must be at least 1, provided " + nLength_ + ".");
		}
		nLength = nLength_;
		slots = new MaskedImage [nLength];
	}

	/** fills all slots from the window image [X,Y,nLength], frames in temporal order **/
	public void initialize(final MaskedImage window)
	{
		if(window.numDimensions() != 3 || window.dimension( 2 ) != nLength)
		{
			throw new IllegalArgumentException("FrameWindow: expected window of " + nLength + " frames, got image "
										+ MiscUtils.getDimensionsText( window.values ) + ".");
		}
		for(int i=0;i<nLength;i++)
		{
			slots[i] = window.hyperSlice( 2, i ).copy();
		}
		nOldest = 0;
		nUpdates = 0;
		recomputeSum();
		bInit = true;
	}

	/** replaces the oldest frame with the provided [X,Y] frame and returns the updated sum **/
	public MaskedImage advance(final MaskedImage frame)
	{
		if(!bInit)
		{
			throw new IllegalStateException("FrameWindow: advance called before initialize.");
		}
		sum.subtract( slots[nOldest] );
		slots[nOldest].set( frame );
		sum.add( slots[nOldest] );
		nOldest = (nOldest + 1) % nLength;
		nUpdates++;
		if(nUpdates % nLength == 0)
		{
			recomputeSum();
		}
		return sum;
	}

	/** sum of all frames in the window (ignoring missing samples).
	 * Returned image is owned by the window and should not be modified. **/
	public MaskedImage currentSum()
	{
		if(!bInit)
		{
			throw new IllegalStateException("FrameWindow: currentSum called before initialize.");
		}
		return sum;
	}

	void recomputeSum()
	{
		final MaskedImage newSum = MaskedImage.create( slots[0].dimensionsAsLongArray() );
		for(int i=0;i<nLength;i++)
		{
			newSum.add( slots[i] );
		}
		sum = newSum;
	}
}
