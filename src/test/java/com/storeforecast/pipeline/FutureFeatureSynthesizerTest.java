package com.storeforecast.pipeline;

import com.storeforecast.config.ForecastProperties;
import com.storeforecast.model.CalendarEvent;
import com.storeforecast.model.CalendarFlags;
import com.storeforecast.model.EventCalendar;
import com.storeforecast.model.EventCategory;
import com.storeforecast.model.EventIntensities;
import com.storeforecast.model.FeatureFrame;
import com.storeforecast.model.Observation;
import com.storeforecast.model.OutlierPolicy;
import com.storeforecast.model.SynthesisMode;
import com.storeforecast.model.SynthesisReport;
import com.storeforecast.support.TestData;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static com.storeforecast.model.FeatureColumns.*;
import static org.assertj.core.api.Assertions.*;

class FutureFeatureSynthesizerTest {

    private static final LocalDate TODAY = TestData.TODAY;

    private ForecastProperties properties;
    private FutureFeatureSynthesizer synthesizer;
    private EventCalendar noEvents;
    private List<Observation> history;

    @BeforeEach
    void setUp() {
        properties = new ForecastProperties();
        synthesizer = new FutureFeatureSynthesizer(properties, TestData.CLOCK);
        noEvents = EventCalendar.empty(properties.getEvents());
        history = TestData.series(TODAY, 60, TestData::weeklyPattern);
    }

    private static List<LocalDate> days(LocalDate first, int count) {
        return first.datesUntil(first.plusDays(count)).toList();
    }

    private static void assertSameFrame(FeatureFrame actual, FeatureFrame expected) {
        assertThat(actual.dates()).isEqualTo(expected.dates());
        assertThat(actual.columnNames()).isEqualTo(expected.columnNames());
        for (String column : expected.columnNames()) {
            assertThat(actual.column(column)).as(column).containsExactly(expected.column(column));
        }
    }

    @Test
    void synthesize_validationMode_ignoresRowsOnOrAfterFirstTargetDate() {
        LocalDate first = TODAY.minusDays(13);
        List<LocalDate> dates = days(first, 14);
        List<Observation> before = history.stream().filter(o -> o.date().isBefore(first)).toList();
        List<Observation> tampered = new ArrayList<>(history);
        for (int i = 0; i < tampered.size(); i++) {
            Observation o = tampered.get(i);
            if (!o.date().isBefore(first)) {
                tampered.set(i, new Observation(o.date(), o.target() * 50, o.transactionCount() * 7,
                    o.averageTicket() * 3, o.flags(), o.intensities()));
            }
        }

        FeatureFrame fromFull = synthesizer.synthesize(dates, history, noEvents, SynthesisMode.VALIDATION);
        FeatureFrame fromBefore = synthesizer.synthesize(dates, before, noEvents, SynthesisMode.VALIDATION);
        FeatureFrame fromTampered = synthesizer.synthesize(dates, tampered, noEvents, SynthesisMode.VALIDATION);

        assertSameFrame(fromFull, fromBefore);
        assertSameFrame(fromTampered, fromBefore);
    }

    @Test
    void synthesize_forecastMode_ignoresRowsDatedAfterToday() {
        List<Observation> withFuture = new ArrayList<>(history);
        withFuture.addAll(TestData.series(TODAY.plusDays(5), 5, i -> 99_999));
        List<LocalDate> dates = days(TODAY.plusDays(6), 10);

        FeatureFrame clean = synthesizer.synthesize(dates, history, noEvents, SynthesisMode.FORECAST);
        FeatureFrame dirty = synthesizer.synthesize(dates, withFuture, noEvents, SynthesisMode.FORECAST);

        assertSameFrame(dirty, clean);
    }

    @Test
    void synthesize_eventsBecomeIntensitiesAndFlags() {
        LocalDate promoDay = TODAY.plusDays(2);
        LocalDate holiday = TODAY.plusDays(3);
        LocalDate closed = TODAY.plusDays(4);
        EventCalendar calendar = EventCalendar.of(List.of(
            new CalendarEvent(promoDay, EventCategory.PROMOTION, "Flash sale", null),
            new CalendarEvent(holiday, EventCategory.HOLIDAY, "Holiday A", 0.9),
            new CalendarEvent(holiday, EventCategory.HOLIDAY, "Holiday B", 0.9),
            new CalendarEvent(closed, EventCategory.STORE_CLOSED, "Renovation", 1.0),
            new CalendarEvent(closed, EventCategory.STORE_CLOSED, "Renovation", 1.0),
            new CalendarEvent(closed, EventCategory.STORE_CLOSED, "Renovation", 1.0)), properties.getEvents());

        FeatureFrame frame = synthesizer.synthesize(days(TODAY.plusDays(1), 7), history, calendar, SynthesisMode.FORECAST);

        assertThat(frame.value(PROMO_INTENSITY, frame.indexOf(promoDay))).isEqualTo(0.4);
        assertThat(frame.value(HOLIDAY_INTENSITY, frame.indexOf(holiday))).isCloseTo(1.8, within(1e-12));
        assertThat(frame.value(CLOSURE_INTENSITY, frame.indexOf(closed))).isEqualTo(2.0);
        assertThat(frame.value(IS_DAY_BEFORE_HOLIDAY, frame.indexOf(promoDay))).isEqualTo(1.0);
        assertThat(frame.value(IS_DAY_BEFORE_HOLIDAY, frame.indexOf(holiday))).isEqualTo(0.0);
        assertThat(frame.column(IS_SCHOOL_HOLIDAY)).containsOnly(0.0);
        assertThat(frame.value(TRANSACTIONS_COUNT, frame.indexOf(closed))).isEqualTo(1.0);
    }

    @Test
    void synthesize_clipsBaselinesToConfiguredRanges() {
        List<Observation> extreme = new ArrayList<>();
        for (LocalDate d : days(TODAY.minusDays(29), 30)) {
            extreme.add(new Observation(d, 10_000, 10_000, 1.0, CalendarFlags.of(d, false, false), EventIntensities.NONE));
        }

        FeatureFrame frame = synthesizer.synthesize(days(TODAY.plusDays(1), 14), extreme, noEvents, SynthesisMode.FORECAST);

        assertThat(frame.column(TRANSACTIONS_COUNT)).containsOnly(500.0);
        assertThat(frame.column(AVG_TICKET)).containsOnly(10.0);
    }

    @Test
    void synthesize_withoutHistory_usesDefaults() {
        FeatureFrame frame = synthesizer.synthesize(days(TODAY.plusDays(1), 7), List.of(), noEvents, SynthesisMode.FORECAST);

        assertThat(frame.column(TRANSACTIONS_COUNT)).containsOnly(50.0);
        assertThat(frame.column(AVG_TICKET)).containsOnly(75.0);
        assertThat(synthesizer.validate(frame).ok()).isTrue();
    }

    @Test
    void synthesize_lagFeaturesComeFromKnownHistory() {
        FeatureFrame frame = synthesizer.synthesize(days(TODAY.plusDays(1), 10), history, noEvents, SynthesisMode.FORECAST);

        Observation weekAgo = history.stream().filter(o -> o.date().equals(TODAY.minusDays(6))).findFirst().orElseThrow();
        assertThat(frame.value(LAG_7, 0)).isEqualTo(weekAgo.target());
        assertThat(Arrays.stream(frame.column(LAG_7)).boxed().toList()).allSatisfy(v -> assertThat(v).isPositive());
        assertThat(synthesizer.validate(frame).ok()).isTrue();
    }

    @Test
    void synthesize_lagFeaturesReadOutlierHandledTarget() {
        List<Observation> spiked = new ArrayList<>(history);
        int spikeIndex = spiked.size() - 7;
        spiked.set(spikeIndex, spiked.get(spikeIndex).withTarget(100_000));
        double[] y = spiked.stream().mapToDouble(Observation::target).toArray();
        double clipped = SeriesStats.percentile(y, properties.getPreprocessing().getClipUpperPercentile());
        List<LocalDate> dates = days(TODAY.plusDays(1), 7);

        FeatureFrame clip = synthesizer.synthesize(dates, spiked, noEvents, SynthesisMode.FORECAST, OutlierPolicy.CLIP);
        FeatureFrame raw = synthesizer.synthesize(dates, spiked, noEvents, SynthesisMode.FORECAST, OutlierPolicy.NONE);

        assertThat(clip.value(LAG_7, 0)).isCloseTo(clipped, within(1e-9)).isLessThan(100_000);
        assertThat(raw.value(LAG_7, 0)).isEqualTo(100_000);
        assertThat(synthesizer.synthesize(dates, spiked, noEvents, SynthesisMode.FORECAST).column(LAG_7))
            .containsExactly(clip.column(LAG_7));
    }

    @Test
    void validate_reportsDuplicatesGapsAndNonFiniteValues() {
        LocalDate d = TODAY;
        FeatureFrame frame = FeatureFrame.of(List.of(d, d, d.plusDays(3)))
            .withColumn(TRANSACTIONS_COUNT, new double[]{1, Double.NaN, 3});

        SynthesisReport report = synthesizer.validate(frame);

        assertThat(report.ok()).isFalse();
        assertThat(report.errors()).anyMatch(e -> e.contains("duplicate date"));
        assertThat(report.errors()).anyMatch(e -> e.contains("missing dates"));
        assertThat(report.errors()).anyMatch(e -> e.contains("non-finite"));
    }

    @Test
    void validate_reportsOutOfOrderAndEmptyFrames() {
        FeatureFrame reversed = FeatureFrame.of(List.of(TODAY.plusDays(1), TODAY));

        assertThat(synthesizer.validate(reversed).errors()).anyMatch(e -> e.contains("out of order"));
        assertThat(synthesizer.validate(FeatureFrame.of(List.of())).ok()).isFalse();
    }

    @Test
    void exponentialSmoothing_blendsWithPreviousSmoothedValue() {
        assertThat(FutureFeatureSynthesizer.exponentialSmoothing(new double[]{10, 20, 20}, 0.3))
            .containsExactly(new double[]{10, 13, 15.1}, within(1e-9));
    }
}
