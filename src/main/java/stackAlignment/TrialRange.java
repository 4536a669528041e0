package stackAlignment;

import java.util.ArrayList;
import java.util.List;

/** Block of frames [nStart, nEnd] (1-based, inclusive) recorded as one trial,
 * registered independently from the other blocks. **/
public final class TrialRange {

	public final int nStart;

	public final int nEnd;

	public TrialRange(final int nStart_, final int nEnd_)
	{
		nStart = nStart_;
		nEnd = nEnd_;
	}

	public int length()
	{
		return nEnd - nStart + 1;
	}

	public boolean contains(final int nFrame)
	{
		return nFrame >= nStart && nFrame <= nEnd;
	}

	/** parses text like "1-100;101-200" (a single number is a block of one frame) **/
	public static List< TrialRange > parse(final String sRanges)
	{
		final List< TrialRange > out = new ArrayList<>();
		if(sRanges == null || sRanges.trim().isEmpty())
		{
			return out;
		}
		for(final String sRange : sRanges.split( ";" ))
		{
			final String sTrim = sRange.trim();
			if(sTrim.isEmpty())
				continue;
			final int nDash = sTrim.indexOf( '-', 1 );
			try
			{
				if(nDash < 0)
				{
					final int nFrame = Integer.parseInt( sTrim );
					out.add( new TrialRange(nFrame, nFrame) );
				}
				else
				{
					out.add( new TrialRange(Integer.parseInt( sTrim.substring( 0, nDash ).trim() ),
											Integer.parseInt( sTrim.substring( nDash + 1 ).trim() )) );
				}
			}
			catch(NumberFormatException e)
			{
				throw new AlignmentConfigurationException("TrialRange: cannot parse trial range \"" + sTrim + "\".");
			}
		}
		return out;
	}

	public static String format(final List< TrialRange > ranges)
	{
		if(ranges == null)
			return "";
		final StringBuilder sb = new StringBuilder();
		for(int i=0;i<ranges.size();i++)
		{
			if(i>0)
				sb.append( ";" );
			sb.append( ranges.get( i ).toString() );
		}
		return sb.toString();
	}

	@Override
	public String toString()
	{
		return nStart + "-" + nEnd;
	}

	@Override
	public boolean equals(final Object obj)
	{
		if(!(obj instanceof TrialRange))
			return false;
		final TrialRange other = (TrialRange) obj;
		return other.nStart == nStart && other.nEnd == nEnd;
	}

	@Override
	public int hashCode()
	{
		return 31*nStart + nEnd;
	}
}
