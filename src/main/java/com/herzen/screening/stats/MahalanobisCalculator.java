package com.herzen.screening.stats;

import org.ejml.data.DMatrixRMaj;
import org.ejml.dense.row.CommonOps_DDRM;
import org.ejml.dense.row.decomposition.svd.SafeSvd_DDRM;
import org.ejml.dense.row.factory.DecompositionFactory_DDRM;
import org.ejml.interfaces.decomposition.SingularValueDecomposition_F64;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class MahalanobisCalculator {
    private static final Logger log = LoggerFactory.getLogger(MahalanobisCalculator.class);

    // reciprocal condition number below which the plain inverse is not trusted
    static final double MIN_RECIPROCAL_CONDITION = 1e-12;

    public MahalanobisOutcome evaluate(List<? extends Number> profile, double[][] referenceData, double pThreshold) {
        int d = profile.size();
        if (referenceData == null || referenceData.length < 2) {
            return new MahalanobisOutcome.Degenerate("At least two reference rows are required, got "
                    + (referenceData == null ? 0 : referenceData.length));
        }
        for (double[] row : referenceData) {
            for (double v : row) {
                if (Double.isNaN(v) || Double.isInfinite(v)) {
                    return new MahalanobisOutcome.Degenerate("Reference data contains non-finite values");
                }
            }
        }

        double[] mean = columnMeans(referenceData, d);
        DMatrixRMaj cov = sampleCovariance(referenceData, mean);

        SingularValueDecomposition_F64<DMatrixRMaj> svd = new SafeSvd_DDRM(DecompositionFactory_DDRM.svd(true, true, true));
        if (!svd.decompose(cov)) {
            return new MahalanobisOutcome.Degenerate("Singular value decomposition of the covariance matrix failed");
        }
        double[] singular = svd.getSingularValues();
        double maxSv = 0.0;
        double minSv = Double.POSITIVE_INFINITY;
        for (int i = 0; i < svd.numberOfSingularValues(); i++) {
            maxSv = Math.max(maxSv, singular[i]);
            minSv = Math.min(minSv, singular[i]);
        }
        if (maxSv == 0.0) {
            return new MahalanobisOutcome.Degenerate("Reference covariance is identically zero");
        }

        DMatrixRMaj inverse = null;
        if (minSv / maxSv >= MIN_RECIPROCAL_CONDITION) {
            DMatrixRMaj candidate = new DMatrixRMaj(d, d);
            if (CommonOps_DDRM.invert(cov.copy(), candidate)) {
                inverse = candidate;
            }
        }
        boolean pseudo = inverse == null;
        if (pseudo) {
            log.warn("Reference covariance is singular or ill-conditioned (rcond={}), using pseudo-inverse", minSv / maxSv);
            inverse = new DMatrixRMaj(d, d);
            CommonOps_DDRM.pinv(cov.copy(), inverse);
        }

        double[] diff = new double[d];
        for (int i = 0; i < d; i++) {
            diff[i] = profile.get(i).doubleValue() - mean[i];
        }
        double d2 = quadraticForm(diff, inverse);
        if (Double.isNaN(d2) || Double.isInfinite(d2)) {
            return new MahalanobisOutcome.Degenerate("Mahalanobis distance is not finite");
        }
        // rounding noise can push a zero distance slightly negative
        d2 = Math.max(0.0, d2);

        double critical = ChiSquaredDistribution.inverseCdf(1.0 - pThreshold, d);
        double pValue = ChiSquaredDistribution.survival(d2, d);
        return new MahalanobisOutcome.Computed(d2, critical, pValue, d, pseudo);
    }

    private static double[] columnMeans(double[][] data, int d) {
        double[] mean = new double[d];
        for (double[] row : data) {
            for (int c = 0; c < d; c++) mean[c] += row[c];
        }
        for (int c = 0; c < d; c++) mean[c] /= data.length;
        return mean;
    }

    // unbiased, divides by n - 1
    private static DMatrixRMaj sampleCovariance(double[][] data, double[] mean) {
        int d = mean.length;
        DMatrixRMaj cov = new DMatrixRMaj(d, d);
        for (double[] row : data) {
            for (int i = 0; i < d; i++) {
                double di = row[i] - mean[i];
                for (int j = i; j < d; j++) {
                    cov.add(i, j, di * (row[j] - mean[j]));
                }
            }
        }
        double denom = data.length - 1.0;
        for (int i = 0; i < d; i++) {
            for (int j = i; j < d; j++) {
                double v = cov.get(i, j) / denom;
                cov.set(i, j, v);
                cov.set(j, i, v);
            }
        }
        return cov;
    }

    private static double quadraticForm(double[] x, DMatrixRMaj m) {
        double total = 0.0;
        for (int i = 0; i < x.length; i++) {
            double row = 0.0;
            for (int j = 0; j < x.length; j++) {
                row += m.get(i, j) * x[j];
            }
            total += x[i] * row;
        }
        return total;
    }
}
