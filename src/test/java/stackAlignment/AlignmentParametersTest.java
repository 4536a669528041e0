package stackAlignment;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.junit.Test;

public class AlignmentParametersTest {

	@Test
	public void defaults()
	{
		final AlignmentParameters params = new AlignmentParameters();
		params.validate();
		assertArrayEquals( new int [] {1}, params.channelCombiner.getChannels() );
		assertFalse( params.bProgressive );
		assertEquals( 1, params.nUpsampling );
		assertTrue( params.reference.isNone() );
		assertEquals( 1, params.nWindowLength );
		assertEquals( Double.POSITIVE_INFINITY, params.dSpatFreqCutoff[1], 0.0 );
		assertNull( params.trialRanges );
		assertFalse( params.bSymmetricEdgeExtension );
	}

	@Test
	public void prefsRoundTrip()
	{
		final AlignmentParameters params = new AlignmentParameters();
		params.channelCombiner = ChannelCombiner.summed( 1, 3 );
		params.nUpsampling = 20;
		params.nWindowLength = 5;
		params.dSpatFreqCutoff = new double [] {0.02, 0.25};
		params.trialRanges = Arrays.asList( new TrialRange(1, 100), new TrialRange(101, 250) );
		params.reference = AlignmentReference.frame( 42 );
		params.bSymmetricEdgeExtension = true;
		params.saveToPrefs();

		final AlignmentParameters loaded = AlignmentParameters.loadFromPrefs();
		assertTrue( loaded.channelCombiner instanceof SummedChannels );
		assertArrayEquals( new int [] {1, 3}, loaded.channelCombiner.getChannels() );
		assertEquals( 20, loaded.nUpsampling );
		assertEquals( 5, loaded.nWindowLength );
		assertArrayEquals( new double [] {0.02, 0.25}, loaded.dSpatFreqCutoff, 0.0 );
		assertEquals( params.trialRanges, loaded.trialRanges );
		assertEquals( AlignmentReference.Kind.FRAME, loaded.reference.kind );
		assertEquals( 42, loaded.reference.nFrame );
		assertTrue( loaded.bSymmetricEdgeExtension );
		assertFalse( loaded.bProgressive );

		final AlignmentParameters progressive = new AlignmentParameters();
		progressive.bProgressive = true;
		progressive.saveToPrefs();
		final AlignmentParameters loadedProgressive = AlignmentParameters.loadFromPrefs();
		assertTrue( loadedProgressive.bProgressive );
		assertTrue( loadedProgressive.reference.isNone() );
		assertNull( loadedProgressive.trialRanges );
		assertEquals( Double.POSITIVE_INFINITY, loadedProgressive.dSpatFreqCutoff[1], 0.0 );
		assertTrue( loadedProgressive.channelCombiner instanceof SingleChannel );
	}

	@Test
	public void reversedCutoffIsSorted()
	{
		final AlignmentParameters params = new AlignmentParameters();
		params.dSpatFreqCutoff = new double [] {0.3, 0.1};
		params.validate();
		assertArrayEquals( new double [] {0.1, 0.3}, params.sortedCutoff(), 0.0 );
	}

	@Test(expected = AlignmentConfigurationException.class)
	public void zeroUpsamplingIsRejected()
	{
		final AlignmentParameters params = new AlignmentParameters();
		params.nUpsampling = 0;
		params.validate();
	}

	@Test(expected = AlignmentConfigurationException.class)
	public void nanCutoffIsRejected()
	{
		final AlignmentParameters params = new AlignmentParameters();
		params.dSpatFreqCutoff = new double [] {Double.NaN, 0.5};
		params.validate();
	}

	@Test(expected = AlignmentConfigurationException.class)
	public void missingCombinerIsRejected()
	{
		final AlignmentParameters params = new AlignmentParameters();
		params.channelCombiner = null;
		params.validate();
	}
}
