package io.tonalis.ji;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.tonalis.ji.comma.CommaCompound;
import io.tonalis.ji.comma.PrimeCommaTable;
import io.tonalis.ji.comma.PythagoreanApproximator;
import io.tonalis.ji.config.TuningConfiguration;
import io.tonalis.ji.harmonicity.BarlowHarmonicity;
import io.tonalis.ji.harmonicity.EulerGradusSuavitatis;
import io.tonalis.ji.harmonicity.SimplifiedBarlowHarmonicity;
import io.tonalis.ji.harmonicity.TenneyHeight;
import io.tonalis.ji.harmonicity.VogelComplexity;
import io.tonalis.ji.harmonicity.WilsonComplexity;
import io.tonalis.ji.ratio.ExponentVector;
import io.tonalis.ji.ratio.RatioCodec;
import io.tonalis.ji.ratio.RatioFactors;
import io.tonalis.ji.ratio.RatioSource;
import org.apache.commons.math3.fraction.BigFraction;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;

/// A pitch, or interval, given as an exact frequency ratio above a concert pitch.
///
/// ## Representation
///
/// The ratio is stored as a canonical [ExponentVector] over the ascending primes;
/// everything else is derived from it on demand:
///
/// ```
///   "15/8"  →  (-3, 1, 1)  →  ratio 15/8, 1088.27 cents, octave 0
///              2⁻³·3¹·5¹       frequency = 15/8 × concert pitch
/// ```
///
/// ## Copy and In-Place Variants
///
/// Every transforming operation comes in two forms that share one pure core:
///
/// | Returns a new pitch          | Replaces this pitch's vector         |
/// |------------------------------|--------------------------------------|
/// | [#add(PitchInterval)]        | [#addInPlace(PitchInterval)]         |
/// | [#subtract(PitchInterval)]   | [#subtractInPlace(PitchInterval)]    |
/// | [#normalize(int)]            | [#normalizeInPlace(int)]             |
/// | [#register(int)]             | [#registerInPlace(int)]              |
/// | [#moveToClosestRegister]     | [#moveToClosestRegisterInPlace]      |
/// | [#inverse(JustIntonationPitch)] | [#inverseInPlace(JustIntonationPitch)] |
/// | [#intersection(JustIntonationPitch, boolean)] | [#intersectionInPlace(JustIntonationPitch, boolean)] |
///
/// ## Equality and Ordering
///
/// Two pitches are equal when their exponent vectors are equal; the concert pitch
/// does not take part. [#intervalEquals(PitchInterval)] compares cents against
/// any interval. Ordering follows the exact ratio.
///
/// ## Thread Safety
///
/// The copy variants never modify the receiver, so a pitch may be shared across
/// threads as long as no thread calls an in-place variant on it.
public final class JustIntonationPitch implements Pitch, PitchInterval, Comparable<JustIntonationPitch> {

    private static final Logger logger = LogManager.getLogger(JustIntonationPitch.class);

    private static final BarlowHarmonicity BARLOW = new BarlowHarmonicity();
    private static final SimplifiedBarlowHarmonicity SIMPLIFIED_BARLOW = new SimplifiedBarlowHarmonicity();
    private static final EulerGradusSuavitatis EULER = new EulerGradusSuavitatis();
    private static final TenneyHeight TENNEY = new TenneyHeight();
    private static final VogelComplexity VOGEL = new VogelComplexity();
    private static final WilsonComplexity WILSON = new WilsonComplexity();

    private static final Set<Integer> DEFAULT_BLUEPRINT_IGNORED_PRIMES = Set.of(2);

    private final Pitch concertPitch;
    private final TuningConfiguration configuration;
    private ExponentVector exponents;

    /// Creates the unison 1/1 above the default concert pitch.
    public JustIntonationPitch() {
        this(new RatioSource.ExponentSequence(ExponentVector.empty()));
    }

    /// @param ratio ratio literal such as `"3/2"`
    /// @throws io.tonalis.ji.ratio.RatioParseException if the literal is malformed
    public JustIntonationPitch(String ratio) {
        this(new RatioSource.RatioLiteral(ratio));
    }

    public JustIntonationPitch(RatioSource source) {
        this(source, null, TuningConfiguration.current());
    }

    public JustIntonationPitch(RatioSource source, Pitch concertPitch) {
        this(source, concertPitch, TuningConfiguration.current());
    }

    /// @param source the ratio
    /// @param concertPitch frequency of 1/1 in Hz
    public JustIntonationPitch(RatioSource source, double concertPitch) {
        this(source, new DirectPitch(concertPitch), TuningConfiguration.current());
    }

    /// @param source the ratio
    /// @param concertPitch the pitch 1/1 sounds at, or null for the configured concert pitch
    /// @param configuration prime ceiling, comma table and default concert pitch to use
    public JustIntonationPitch(RatioSource source, Pitch concertPitch, TuningConfiguration configuration) {
        Objects.requireNonNull(source, "source cannot be null");
        this.configuration = Objects.requireNonNull(configuration, "configuration cannot be null");
        this.concertPitch = concertPitch != null ? concertPitch : configuration.getConcertPitchAsPitch();
        this.exponents = configuration.getCodec().toExponentVector(source);
    }

    /// Creates a pitch from any value [RatioSource#from(Object)] accepts.
    ///
    /// @param value a ratio literal, fraction, integer or exponent sequence
    /// @return the pitch
    public static JustIntonationPitch of(Object value) {
        return new JustIntonationPitch(RatioSource.from(value));
    }

    public static JustIntonationPitch ofExponents(int... exponents) {
        return new JustIntonationPitch(RatioSource.exponents(exponents));
    }

    private JustIntonationPitch derive(ExponentVector vector) {
        return new JustIntonationPitch(new RatioSource.ExponentSequence(vector), concertPitch, configuration);
    }

    private RatioCodec codec() {
        return configuration.getCodec();
    }

    // Plain accessors

    public ExponentVector getExponentVector() {
        return exponents;
    }

    public Pitch getConcertPitch() {
        return concertPitch;
    }

    public TuningConfiguration getConfiguration() {
        return configuration;
    }

    /// @return the reduced fraction, not folded into an octave
    public BigFraction getRatio() {
        return codec().toFraction(exponents);
    }

    public BigInteger getNumerator() {
        return codec().toNumerator(exponents);
    }

    public BigInteger getDenominator() {
        return codec().toDenominator(exponents);
    }

    @Override
    public double getFrequency() {
        return getRatio().doubleValue() * concertPitch.getFrequency();
    }

    /// @return the size of the ratio in cents
    @Override
    public double getInterval() {
        return Pitch.ratioToCents(getRatio());
    }

    public double doubleValue() {
        return getRatio().doubleValue();
    }

    /// Returns the octave the ratio lies in, `floor(log2(ratio))`, computed exactly:
    /// 1/1 to 2/1 (exclusive) is octave 0, 1/2 to 1/1 is octave −1.
    ///
    /// @return the signed octave
    public int getOctave() {
        BigInteger numerator = getNumerator();
        BigInteger denominator = getDenominator();
        int octave = numerator.bitLength() - denominator.bitLength();
        BigInteger scaledNumerator = octave < 0 ? numerator.shiftLeft(-octave) : numerator;
        BigInteger scaledDenominator = octave > 0 ? denominator.shiftLeft(octave) : denominator;
        if (scaledNumerator.compareTo(scaledDenominator) < 0) {
            octave--;
        }
        return octave;
    }

    /// Returns the tonality: true (otonal) unless the pitch is dominated by its
    /// denominator, i.e. all exponents are at most zero with at least one
    /// negative, or the most negative exponent sits on a higher prime than the
    /// largest one.
    ///
    /// @return true for otonal pitches, false for utonal ones
    public boolean isOtonal() {
        if (exponents.isEmpty()) {
            return true;
        }
        int maximum = exponents.max();
        int minimum = exponents.min();
        boolean utonal = (maximum <= 0 && minimum < 0)
            || (minimum < 0 && exponents.indexOf(minimum) > exponents.indexOf(maximum));
        return !utonal;
    }

    // Factorization

    public RatioFactors getFactors() {
        return RatioFactors.of(exponents, configuration.getPrimes());
    }

    /// @return the primes covered by the exponent vector, including those with exponent 0
    public List<Integer> getPrimes() {
        return configuration.getPrimes().firstPrimes(exponents.size());
    }

    /// @return the primes with a non-zero exponent
    public List<Integer> getOccupiedPrimes() {
        List<Integer> occupied = new ArrayList<>();
        for (int i = 0; i < exponents.size(); i++) {
            if (exponents.get(i) != 0) {
                occupied.add(configuration.getPrimes().primeAt(i));
            }
        }
        return Collections.unmodifiableList(occupied);
    }

    /// @return all prime factors with multiplicity; `[1]` for 1/1
    public List<Integer> getFactorised() {
        return getFactors().getFactorised();
    }

    /// @return two lists: the numerator factors and the denominator factors; `[[1], []]` for 1/1
    public List<List<Integer>> getFactorisedNumeratorAndDenominator() {
        RatioFactors factors = getFactors();
        return List.of(factors.getNumeratorFactorList(), factors.getDenominatorFactorList());
    }

    /// @return two lists: distinct primes of the numerator and of the denominator
    public List<List<Integer>> getPrimesForNumeratorAndDenominator() {
        RatioFactors factors = getFactors();
        return List.of(
            List.copyOf(factors.getNumeratorFactors().keySet()),
            List.copyOf(factors.getDenominatorFactors().keySet()));
    }

    /// Returns which harmonic (positive) or subharmonic (negative) of 1/1 this
    /// ratio is. 0 means it is neither; 1/1 itself is harmonic 1.
    ///
    /// @return the signed harmonic number
    public BigInteger getHarmonic() {
        BigInteger numerator = getNumerator();
        BigInteger denominator = getDenominator();
        if (!denominator.testBit(0)) {
            return numerator;
        }
        if (!numerator.testBit(0)) {
            return denominator.negate();
        }
        if (numerator.equals(BigInteger.ONE) && denominator.equals(BigInteger.ONE)) {
            return BigInteger.ONE;
        }
        return BigInteger.ZERO;
    }

    /// @return the blueprint ignoring the prime 2
    public List<List<Integer>> getBlueprint() {
        return getBlueprint(DEFAULT_BLUEPRINT_IGNORED_PRIMES);
    }

    /// Describes the shape of the numerator and denominator: for each, entry `i`
    /// counts how many primes occur exactly `i + 1` times.
    ///
    /// ```
    ///   135/128 = 3³·5 / 2⁷  →  [[1, 0, 1], []]
    /// ```
    ///
    /// @param ignoredPrimes primes left out of the count
    /// @return numerator and denominator blueprints
    public List<List<Integer>> getBlueprint(Set<Integer> ignoredPrimes) {
        RatioFactors factors = getFactors();
        return List.of(
            blueprint(factors.getNumeratorFactors(), ignoredPrimes),
            blueprint(factors.getDenominatorFactors(), ignoredPrimes));
    }

    private static List<Integer> blueprint(SortedMap<Integer, Integer> factors, Set<Integer> ignoredPrimes) {
        SortedMap<Integer, Integer> multiplicityCounts = new TreeMap<>();
        for (Map.Entry<Integer, Integer> entry : factors.entrySet()) {
            if (!ignoredPrimes.contains(entry.getKey())) {
                multiplicityCounts.merge(entry.getValue(), 1, Integer::sum);
            }
        }
        if (multiplicityCounts.isEmpty()) {
            return List.of();
        }
        List<Integer> blueprint = new ArrayList<>();
        for (int multiplicity = 1; multiplicity <= multiplicityCounts.lastKey(); multiplicity++) {
            blueprint.add(multiplicityCounts.getOrDefault(multiplicity, 0));
        }
        return Collections.unmodifiableList(blueprint);
    }

    // Harmonicity

    public double getHarmonicityBarlow() {
        return BARLOW.evaluate(getFactors());
    }

    public double getHarmonicitySimplifiedBarlow() {
        return SIMPLIFIED_BARLOW.evaluate(getFactors());
    }

    public int getHarmonicityEuler() {
        return EULER.gradus(getFactors());
    }

    public double getHarmonicityTenney() {
        return TENNEY.evaluate(getFactors());
    }

    public int getHarmonicityVogel() {
        return VOGEL.complexity(getFactors());
    }

    public int getHarmonicityWilson() {
        return WILSON.complexity(getFactors());
    }

    // Comma notation

    /// @return the Helmholtz-Ellis commas (or the configured table's commas) notating this pitch
    /// @throws IllegalArgumentException if the configured table has no comma for one of its primes
    public CommaCompound getHelmholtzEllisCommas() {
        return approximator().commasOf(this);
    }

    /// @param table the commas to notate primes above 3 with
    /// @return the comma compound of this pitch
    /// @throws IllegalArgumentException if the table has no comma for one of its primes
    public CommaCompound getCommas(PrimeCommaTable table) {
        return new PythagoreanApproximator(table).commasOf(this);
    }

    /// @return the 3-limit interval left after removing this pitch's commas, within one octave
    /// @throws IllegalArgumentException if the configured table has no comma for one of its primes
    public JustIntonationPitch getClosestPythagoreanInterval() {
        return approximator().closestPythagoreanInterval(this);
    }

    /// @return cents from the closest equal-tempered pitch class
    /// @throws IllegalArgumentException if the configured table has no comma for one of its primes
    public double getCentDeviationFromClosestWesternPitchClass() {
        return approximator().centDeviationFromClosestWesternPitchClass(this);
    }

    /// @return the closest pythagorean pitch name with 1/1 standing for "a"
    /// @throws IllegalArgumentException if the configured table has no comma for one of its primes
    public String getClosestPythagoreanPitchName() {
        return getClosestPythagoreanPitchName(TuningConstants.DEFAULT_REFERENCE_PITCH_NAME);
    }

    /// @param reference the pitch name 1/1 stands for, e.g. "c" or "ef"
    /// @return the closest pythagorean pitch name
    /// @throws IllegalArgumentException if the configured table has no comma for one of its primes
    public String getClosestPythagoreanPitchName(String reference) {
        return approximator().closestPythagoreanPitchName(this, reference);
    }

    private PythagoreanApproximator approximator() {
        return new PythagoreanApproximator(configuration.getPrimeCommaTable());
    }

    // Arithmetic

    /// Adds an interval. A just pitch is added exactly. Any other interval is
    /// split into whole octaves, which are added exactly, and a remainder within
    /// the octave, which is approximated by the closest continued-fraction
    /// convergent of `2^(cents/1200)` with a denominator below both
    /// [TuningConstants#CENTS_APPROXIMATION_MAX_DENOMINATOR] and half the prime
    /// ceiling. The approximation therefore never needs a prime beyond the
    /// ceiling; with the default ceiling it lies within a few thousandths of a
    /// cent of the requested size.
    ///
    /// @param interval the interval to add
    /// @return a new pitch
    /// @throws ArithmeticException if the interval spans more octaves than an `int` holds
    public JustIntonationPitch add(PitchInterval interval) {
        return derive(sum(interval));
    }

    /// @param interval the interval to add
    /// @return this pitch
    public JustIntonationPitch addInPlace(PitchInterval interval) {
        exponents = sum(interval);
        return this;
    }

    public JustIntonationPitch subtract(PitchInterval interval) {
        return derive(difference(interval));
    }

    public JustIntonationPitch subtractInPlace(PitchInterval interval) {
        exponents = difference(interval);
        return this;
    }

    /// @return a copy folded into the octave `[1/1, 2/1)`
    public JustIntonationPitch normalize() {
        return normalize(2);
    }

    /// @param period the period to fold by, e.g. 3 for the tritave
    /// @return a copy folded into `[1/1, period/1)`
    public JustIntonationPitch normalize(int period) {
        return derive(normalized(period));
    }

    public JustIntonationPitch normalizeInPlace() {
        return normalizeInPlace(2);
    }

    public JustIntonationPitch normalizeInPlace(int period) {
        exponents = normalized(period);
        return this;
    }

    /// Moves the pitch into a given octave relative to 1/1: 0 is `[1/1, 2/1)`,
    /// −1 is `[1/2, 1/1)` and so on.
    ///
    /// @param octave the signed target octave
    /// @return a copy in that octave
    public JustIntonationPitch register(int octave) {
        return derive(registered(octave));
    }

    public JustIntonationPitch registerInPlace(int octave) {
        exponents = registered(octave);
        return this;
    }

    /// Moves the pitch to the octave closest to a reference pitch. Only the
    /// reference's own octave and its two neighbours are considered; on equal
    /// distance the lower octave wins.
    ///
    /// @param reference the pitch to get close to
    /// @return a copy in the closest octave
    /// @throws RegisterResolutionException if no candidate has a finite distance
    public JustIntonationPitch moveToClosestRegister(JustIntonationPitch reference) {
        return derive(closestRegister(reference));
    }

    public JustIntonationPitch moveToClosestRegisterInPlace(JustIntonationPitch reference) {
        exponents = closestRegister(reference);
        return this;
    }

    /// @return the reciprocal ratio as a new pitch
    public JustIntonationPitch inverse() {
        return inverse(null);
    }

    /// Mirrors the pitch around an axis: `axis − (this − axis)`.
    ///
    /// @param axis the mirror axis, or null for 1/1
    /// @return the mirrored pitch
    public JustIntonationPitch inverse(JustIntonationPitch axis) {
        return derive(inverted(axis));
    }

    public JustIntonationPitch inverseInPlace() {
        return inverseInPlace(null);
    }

    public JustIntonationPitch inverseInPlace(JustIntonationPitch axis) {
        exponents = inverted(axis);
        return this;
    }

    public JustIntonationPitch intersection(JustIntonationPitch other) {
        return intersection(other, false);
    }

    /// Keeps the prime powers both pitches share, at no greater multiplicity than
    /// either holds. Positions with opposite signs are dropped.
    ///
    /// @param other the pitch to intersect with
    /// @param strict keep only exponents that are identical in both pitches
    /// @return the common part as a new pitch
    public JustIntonationPitch intersection(JustIntonationPitch other, boolean strict) {
        return derive(intersected(other, strict));
    }

    public JustIntonationPitch intersectionInPlace(JustIntonationPitch other) {
        return intersectionInPlace(other, false);
    }

    public JustIntonationPitch intersectionInPlace(JustIntonationPitch other, boolean strict) {
        exponents = intersected(other, strict);
        return this;
    }

    /// @return this ratio if it lies above 1/1, else its reciprocal
    public JustIntonationPitch abs() {
        if (getNumerator().compareTo(getDenominator()) > 0) {
            return derive(exponents);
        }
        return derive(exponents.negate());
    }

    @Override
    public PitchInterval getPitchInterval(Pitch other) {
        if (other instanceof JustIntonationPitch) {
            return ((JustIntonationPitch) other).subtract(this);
        }
        return Pitch.super.getPitchInterval(other);
    }

    private ExponentVector sum(PitchInterval interval) {
        Objects.requireNonNull(interval, "interval cannot be null");
        if (interval instanceof JustIntonationPitch) {
            return exponents.add(((JustIntonationPitch) interval).exponents);
        }
        return exponents.add(centsToExponents(interval.getInterval()));
    }

    private ExponentVector difference(PitchInterval interval) {
        Objects.requireNonNull(interval, "interval cannot be null");
        if (interval instanceof JustIntonationPitch) {
            return exponents.subtract(((JustIntonationPitch) interval).exponents);
        }
        return exponents.subtract(centsToExponents(interval.getInterval()));
    }

    private ExponentVector centsToExponents(double cents) {
        if (!Double.isFinite(cents)) {
            throw new IllegalArgumentException("Interval must be finite, got: " + cents + " cents");
        }
        double octaves = Math.floor(cents / TuningConstants.OCTAVE_IN_CENTS);
        double remainder = cents - octaves * TuningConstants.OCTAVE_IN_CENTS;
        BigFraction withinOctave = Pitch.centsToRatio(remainder, centsApproximationDenominator());
        ExponentVector shift = codec().toExponentVector(withinOctave)
            .add(ExponentVector.of(Math.toIntExact((long) octaves)));
        logger.debug("Approximated {} cents as {} octaves and ratio {}", cents, (long) octaves,
            RatioCodec.format(withinOctave));
        return shift;
    }

    // a within-octave numerator stays below twice the denominator, so it cannot exceed the prime ceiling
    private int centsApproximationDenominator() {
        return Math.max(1, Math.min(TuningConstants.CENTS_APPROXIMATION_MAX_DENOMINATOR,
            configuration.getPrimeCeiling() / 2));
    }

    private ExponentVector normalized(int period) {
        return codec().toExponentVector(RatioCodec.adjustRatio(getRatio(), period));
    }

    private ExponentVector registered(int octave) {
        return normalized(2).add(ExponentVector.of(octave));
    }

    private ExponentVector closestRegister(JustIntonationPitch reference) {
        Objects.requireNonNull(reference, "reference cannot be null");
        int referenceOctave = reference.getOctave();
        double referenceCents = reference.getInterval();

        ExponentVector[] candidates = new ExponentVector[3];
        double[] distances = new double[candidates.length];
        for (int i = 0; i < candidates.length; i++) {
            candidates[i] = registered(referenceOctave - 1 + i);
            double cents = Pitch.ratioToCents(codec().toFraction(candidates[i]));
            distances[i] = Math.abs(cents - referenceCents);
        }
        int closest = closestIndex(distances);
        logger.debug("Closest register of {} to {} is octave {}", this, reference, referenceOctave - 1 + closest);
        return candidates[closest];
    }

    /// Picks the smallest finite distance; a later candidate only wins when it
    /// is strictly closer.
    static int closestIndex(double[] distances) {
        int closest = -1;
        for (int i = 0; i < distances.length; i++) {
            if (!Double.isFinite(distances[i])) {
                continue;
            }
            if (closest < 0 || distances[i] < distances[closest]) {
                closest = i;
            }
        }
        if (closest < 0) {
            throw new RegisterResolutionException(
                "None of the " + distances.length + " candidate registers has a finite distance",
                distances.length);
        }
        return closest;
    }

    private ExponentVector inverted(JustIntonationPitch axis) {
        if (axis == null) {
            return exponents.negate();
        }
        return axis.exponents.subtract(exponents.subtract(axis.exponents));
    }

    private ExponentVector intersected(JustIntonationPitch other, boolean strict) {
        Objects.requireNonNull(other, "other cannot be null");
        return exponents.intersect(other.exponents, strict);
    }

    /// Compares the interval size in cents with any interval.
    ///
    /// @param interval the interval to compare with
    /// @return true if both have the same size in cents
    public boolean intervalEquals(PitchInterval interval) {
        if (interval instanceof JustIntonationPitch) {
            return equals(interval);
        }
        return interval != null && Double.compare(getInterval(), interval.getInterval()) == 0;
    }

    @Override
    public int compareTo(JustIntonationPitch other) {
        return getRatio().compareTo(other.getRatio());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof JustIntonationPitch)) return false;
        return exponents.equals(((JustIntonationPitch) o).exponents);
    }

    @Override
    public int hashCode() {
        return exponents.hashCode();
    }

    @Override
    public String toString() {
        return "JustIntonationPitch('" + RatioCodec.format(getRatio()) + "')";
    }
}
