package stackAlignment;

import net.imglib2.RandomAccessibleInterval;
import net.imglib2.type.numeric.real.FloatType;

/** Read-only time-lapse image stack [X,Y,F] or [X,Y,F,C].
 * Frame and channel indices are 1-based. NaN samples denote missing data. **/
public interface FrameStack {

	/** size along X (image dimension 0) **/
	long getWidth();

	/** size along Y (image dimension 1) **/
	long getHeight();

	int getNFrames();

	int getNChannels();

	/** reads the requested frames and channels,
	 * @return image [X, Y, frames.length, channels.length] **/
	RandomAccessibleInterval< FloatType > readFrames(int [] frames, int [] channels);

	BlankNormalisation getNormalisation();

	void setNormalisation(BlankNormalisation mode);
}
