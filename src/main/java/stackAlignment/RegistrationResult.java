package stackAlignment;

/** Result of a single phase correlation registration **/
public class RegistrationResult {

	/** displacement of the target relative to reference along Y (image dimension 1), pixels **/
	public final double dShiftY;

	/** displacement of the target relative to reference along X (image dimension 0), pixels **/
	public final double dShiftX;

	/** normalised correlation error, 0 means perfect match, 1 means no correlation **/
	public final double dError;

	/** global phase difference at the correlation peak, radians **/
	public final double dPhase;

	public RegistrationResult(final double dShiftY_, final double dShiftX_, final double dError_, final double dPhase_)
	{
		dShiftY = dShiftY_;
		dShiftX = dShiftX_;
		dError = dError_;
		dPhase = dPhase_;
	}

	/** result for inputs without any signal **/
	public static RegistrationResult noSignal()
	{
		return new RegistrationResult(0.0, 0.0, 1.0, 0.0);
	}

	@Override
	public String toString()
	{
		return "shift Y=" + dShiftY + " X=" + dShiftX + " error=" + dError + " phase=" + dPhase;
	}
}
