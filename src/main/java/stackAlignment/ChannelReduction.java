package stackAlignment;

/** User supplied reduction of a slab [X,Y,W,C] of selected frames and channels to [X,Y,W] **/
@FunctionalInterface
public interface ChannelReduction {

	MaskedImage reduce(MaskedImage slab);
}
