package at.sv.panchang.astro;

/**
 * One periodic term of the lunar longitude series: multiples of D, M, M', F and the sine coefficient in 1e-6 degree.
 */
record MoonTerm(int d, int m, int mPrime, int f, double coefficient) {
}
