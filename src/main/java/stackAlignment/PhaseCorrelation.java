package stackAlignment;

/** Sub-pixel translation registration of two images by phase correlation
 * with matrix-multiply up-sampled DFT refinement of the correlation peak
 * (after Guizar-Sicairos, Thurman and Fienup, Opt. Lett. 33, 156 (2008)).
 * Works on spectra, so band-pass filtering can be applied beforehand. **/
public class PhaseCorrelation {

	/** registers two 2D images of the same size, no filtering **/
	public static RegistrationResult register(final MaskedImage reference, final MaskedImage target, final int nUpsampling)
	{
		if(reference.numDimensions()!=2 || target.numDimensions()!=2)
		{
			throw new IllegalArgumentException("PhaseCorrelation: only 2D images can be registered.");
		}
		if(reference.dimension( 0 )!=target.dimension( 0 ) || reference.dimension( 1 )!=target.dimension( 1 ))
		{
			throw new ReferenceSizeMismatchException("PhaseCorrelation: image sizes "+MiscUtils.getDimensionsText( reference.values )
									+ " and " + MiscUtils.getDimensionsText( target.values ) + " do not match.");
		}
		return register(Spectrum.of( reference ), Spectrum.of( target ), nUpsampling);
	}

	/**
	 * Finds displacement of the target relative to the reference.
	 * @param reference spectrum of the reference image
	 * @param target spectrum of the target image (same size), a dimension of length 1 reports zero shift
	 * @param nUpsampling precision of the estimate is 1/nUpsampling pixels
	 * @return shifting target by (-dShiftY,-dShiftX) aligns it best with the reference
	 */
	public static RegistrationResult register(final Spectrum reference, final Spectrum target, final int nUpsampling)
	{
		if(nUpsampling < 1)
		{
			throw new AlignmentConfigurationException("PhaseCorrelation: upsampling factor must be at least 1, provided " + nUpsampling + ".");
		}
		if(reference.nWidth != target.nWidth || reference.nHeight != target.nHeight)
		{
			throw new ReferenceSizeMismatchException("PhaseCorrelation: spectra sizes " + reference.nWidth + "x" + reference.nHeight
					+ " and " + target.nWidth + "x" + target.nHeight + " do not match.");
		}
		final double dEnergyRef = reference.energy();
		final double dEnergyTarget = target.energy();
		if(dEnergyRef == 0.0 || dEnergyTarget == 0.0)
		{
			return RegistrationResult.noSignal();
		}

		final int nWidth = reference.nWidth;
		final int nHeight = reference.nHeight;
		final boolean bFixedX = (nWidth == 1);
		final boolean bFixedY = (nHeight == 1);
		final Spectrum cross = reference.conjugateMultiply( target );

		//coarse peak at integer resolution
		final double [] cc = cross.inverseReal();
		int nPeakX = 0, nPeakY = 0;
		double dBestMag = -1.0;
		double dBestDist = Double.MAX_VALUE;
		double dMag, dDist;
		int x, y, nLagX, nLagY;
		final int nMaxY = bFixedY ? 1 : nHeight;
		final int nMaxX = bFixedX ? 1 : nWidth;
		for(y=0;y<nMaxY;y++)
			for(x=0;x<nMaxX;x++)
			{
				nLagX = MiscUtils.wrapLag( x, nWidth );
				nLagY = MiscUtils.wrapLag( y, nHeight );
				dMag = Math.abs( cc[y*nWidth + x] );
				dDist = Math.abs( nLagX ) + Math.abs( nLagY );
				if(MiscUtils.isBetterPeak( dMag, dDist, dBestMag, dBestDist ))
				{
					dBestMag = dMag;
					dBestDist = dDist;
					nPeakX = nLagX;
					nPeakY = nLagY;
				}
			}

		double dLagX = nPeakX;
		double dLagY = nPeakY;
		double [] ccMax;

		if(nUpsampling == 1)
		{
			ccMax = upsampledCorrelation( cross, dLagY, dLagX, 1, 1, 1.0 );
		}
		else
		{
			// fine grid of ceil(1.5*U) points around the coarse peak
			final int nOut = (int) Math.ceil( 1.5*nUpsampling );
			final int nCenter = nOut/2;
			final int nOutY = bFixedY ? 1 : nOut;
			final int nOutX = bFixedX ? 1 : nOut;
			final int nCenterY = bFixedY ? 0 : nCenter;
			final int nCenterX = bFixedX ? 0 : nCenter;
			final double dStep = 1.0/nUpsampling;
			final double dLagY0 = nPeakY - nCenterY*dStep;
			final double dLagX0 = nPeakX - nCenterX*dStep;

			final double [] fine = upsampledCorrelation( cross, dLagY0, dLagX0, nOutY, nOutX, dStep );
			int nBestInd = 0;
			dBestMag = -1.0;
			dBestDist = Double.MAX_VALUE;
			double dRe, dIm;
			for(y=0;y<nOutY;y++)
				for(x=0;x<nOutX;x++)
				{
					final int nInd = y*nOutX + x;
					dRe = fine[2*nInd];
					dIm = fine[2*nInd+1];
					dMag = dRe*dRe + dIm*dIm;
					dDist = Math.abs( nPeakY + (y - nCenterY)*dStep ) + Math.abs( nPeakX + (x - nCenterX)*dStep );
					if(MiscUtils.isBetterPeak( dMag, dDist, dBestMag, dBestDist ))
					{
						dBestMag = dMag;
						dBestDist = dDist;
						nBestInd = nInd;
					}
				}
			final int nBestY = nBestInd / nOutX;
			final int nBestX = nBestInd % nOutX;
			dLagY = nPeakY + ((double)(nBestY - nCenterY))/nUpsampling;
			dLagX = nPeakX + ((double)(nBestX - nCenterX))/nUpsampling;
			ccMax = new double [] {fine[2*nBestInd], fine[2*nBestInd+1]};
		}

		final double dCorrSq = (ccMax[0]*ccMax[0] + ccMax[1]*ccMax[1])/(dEnergyRef*dEnergyTarget);
		final double dError = Math.sqrt( Math.abs( 1.0 - dCorrSq ) );
		final double dPhase = Math.atan2( ccMax[1], ccMax[0] );

		// peak is at the lag opposite to the displacement
		return new RegistrationResult(MiscUtils.noNegativeZero( -dLagY ), MiscUtils.noNegativeZero( -dLagX ), dError, dPhase);
	}

	/** Evaluates cross-correlation (not normalised) from its spectrum
	 * on nOutY x nOutX grid of lags starting at (dLagY0, dLagX0) with dStep spacing.
	 * Separable DFT: kernel along X is applied first, then along Y.
	 * @return interleaved complex values, row-major **/
	static double [] upsampledCorrelation(final Spectrum cross, final double dLagY0, final double dLagX0,
			final int nOutY, final int nOutX, final double dStep)
	{
		final int nWidth = cross.nWidth;
		final int nHeight = cross.nHeight;
		final double [] freqX = BandPassFilter.frequencies( nWidth );
		final double [] freqY = BandPassFilter.frequencies( nHeight );
		final double [] kernXRe = new double [nOutX*nWidth];
		final double [] kernXIm = new double [nOutX*nWidth];
		final double [] kernYRe = new double [nOutY*nHeight];
		final double [] kernYIm = new double [nOutY*nHeight];
		int i, j, k;
		double dArg;
		for(j=0;j<nOutX;j++)
			for(k=0;k<nWidth;k++)
			{
				dArg = 2.0*Math.PI*freqX[k]*(dLagX0 + j*dStep);
				kernXRe[j*nWidth+k] = Math.cos( dArg );
				kernXIm[j*nWidth+k] = Math.sin( dArg );
			}
		for(i=0;i<nOutY;i++)
			for(k=0;k<nHeight;k++)
			{
				dArg = 2.0*Math.PI*freqY[k]*(dLagY0 + i*dStep);
				kernYRe[i*nHeight+k] = Math.cos( dArg );
				kernYIm[i*nHeight+k] = Math.sin( dArg );
			}

		// rows of the spectrum times kernel along X
		final double [] tRe = new double [nHeight*nOutX];
		final double [] tIm = new double [nHeight*nOutX];
		final double [] data = cross.data;
		double dSumRe, dSumIm, dCRe, dCIm;
		int ky;
		for(ky=0;ky<nHeight;ky++)
			for(j=0;j<nOutX;j++)
			{
				dSumRe = 0.0;
				dSumIm = 0.0;
				for(k=0;k<nWidth;k++)
				{
					dCRe = data[2*(ky*nWidth+k)];
					dCIm = data[2*(ky*nWidth+k)+1];
					dSumRe += dCRe*kernXRe[j*nWidth+k] - dCIm*kernXIm[j*nWidth+k];
					dSumIm += dCRe*kernXIm[j*nWidth+k] + dCIm*kernXRe[j*nWidth+k];
				}
				tRe[ky*nOutX+j] = dSumRe;
				tIm[ky*nOutX+j] = dSumIm;
			}

		final double [] out = new double [2*nOutY*nOutX];
		for(i=0;i<nOutY;i++)
			for(j=0;j<nOutX;j++)
			{
				dSumRe = 0.0;
				dSumIm = 0.0;
				for(ky=0;ky<nHeight;ky++)
				{
					dCRe = tRe[ky*nOutX+j];
					dCIm = tIm[ky*nOutX+j];
					dSumRe += dCRe*kernYRe[i*nHeight+ky] - dCIm*kernYIm[i*nHeight+ky];
					dSumIm += dCRe*kernYIm[i*nHeight+ky] + dCIm*kernYRe[i*nHeight+ky];
				}
				out[2*(i*nOutX+j)] = dSumRe;
				out[2*(i*nOutX+j)+1] = dSumIm;
			}
		return out;
	}
}
