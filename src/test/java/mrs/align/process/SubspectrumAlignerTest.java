package mrs.align.process;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

import java.util.ArrayList;
import java.util.List;
import mrs.align.EditingMode;
import mrs.align.input.AlignmentConfiguration;
import mrs.align.input.Spectrum;
import mrs.align.output.CorrectionVector;
import mrs.align.output.PairwiseAlignment;
import mrs.align.output.SubspectrumAlignment;
import mrs.align.process.PreconditionException.Reason;
import mrs.align.test.TestUtils;
import org.junit.Test;

public class SubspectrumAlignerTest {

  private static SubspectrumAligner sequentialAligner() {
    return new SubspectrumAligner(new AlignmentConfiguration());
  }

  private static void assertRejected(Reason reason, Runnable call) {
    try {
      call.run();
      fail("Expected " + reason);
    } catch (PreconditionException e) {
      assertEquals(reason, e.getReason());
    }
  }

  @Test
  public void megaPackedAlignsBOntoA() {
    Spectrum a = TestUtils.single(TestUtils.editedFid());
    Spectrum b = TestUtils.shifted(a, 2., 5.);
    Spectrum packed = Spectrum.mergeSubspectra(a, b);

    SubspectrumAlignment result = sequentialAligner().align(packed, EditingMode.MEGA);
    assertEquals(1, result.getSteps().size());
    CorrectionVector correction = result.getCorrections().get(0);
    assertEquals(-2., correction.getFrequencyShift(), 0.5);
    assertEquals(-5., correction.getPhaseShift(), 1.);
    assertTrue(result.allConverged());

    Spectrum aligned = result.getAligned();
    assertEquals(2, aligned.getSubspectrumCount());
    assertEquals(packed.getSampleCount(), aligned.getSampleCount());
    assertTrue(aligned.hasSameAxes(packed));
    // reference passes through untouched
    assertArrayEquals(a.getFids(0), aligned.getFids(0));
    assertArrayEquals(b.applyCorrection(correction).getFids(0), aligned.getFids(1));
  }

  @Test
  public void megaSeparatedMatchesPacked() {
    Spectrum a = TestUtils.single(TestUtils.baseFid());
    Spectrum b = TestUtils.shifted(a, -1., 8.);
    SubspectrumAligner aligner = sequentialAligner();

    SubspectrumAlignment separated = aligner.align(EditingMode.MEGA, a, b);
    SubspectrumAlignment packed = aligner.align(Spectrum.mergeSubspectra(a, b),
        EditingMode.MEGA);
    assertEquals(packed.getCorrections(), separated.getCorrections());
    assertEquals(2, separated.getAligned().getSubspectrumCount());
  }

  @Test
  public void alignPairKeepsSpectraSeparate() {
    Spectrum a = TestUtils.single(TestUtils.baseFid());
    Spectrum b = TestUtils.shifted(a, 1., 0.);
    PairwiseAlignment result = sequentialAligner().alignPair(a, b);
    assertEquals(1, result.getCorrected().getSubspectrumCount());
    assertEquals(1, result.getReference().getSubspectrumCount());
    assertEquals(-1., result.getCorrection().getFrequencyShift(), 0.5);
  }

  @Test
  public void fourWayAlignsDOntoCorrectedC() {
    Spectrum[] subspectra = TestUtils.fourWaySubspectra();
    SubspectrumAlignment result = sequentialAligner().align(EditingMode.HERMES, subspectra);

    List<PairwiseAlignment> steps = result.getSteps();
    assertEquals(3, steps.size());
    assertEquals(-1.5, steps.get(0).getCorrection().getFrequencyShift(), 0.5);
    // D was offset from the uncorrected C, so its correction also carries C's
    assertEquals(2., steps.get(2).getCorrection().getFrequencyShift()
        - steps.get(1).getCorrection().getFrequencyShift(), 0.5);
    assertEquals(6., steps.get(2).getCorrection().getPhaseShift()
        - steps.get(1).getCorrection().getPhaseShift(), 1.);

    // D is compared against the corrected C, which shares the edited line, so it can be
    // matched almost exactly; against A it cannot
    PairwiseAlignment dOntoC = steps.get(2);
    assertArrayEquals(steps.get(1).getCorrected().getFids(0),
        dOntoC.getReference().getFids(0));
    PairwiseAlignment dOntoA = new PairwiseAligner(new AlignmentConfiguration())
        .align(subspectra[0], subspectra[3]);
    assertTrue(dOntoC.getFinalObjective() < dOntoA.getFinalObjective());

    Spectrum aligned = result.getAligned();
    assertEquals(4, aligned.getSubspectrumCount());
    assertArrayEquals(subspectra[0].getFids(0), aligned.getFids(0));
    assertArrayEquals(steps.get(0).getCorrected().getFids(0), aligned.getFids(1));
    assertArrayEquals(steps.get(1).getCorrected().getFids(0), aligned.getFids(2));
    assertArrayEquals(dOntoC.getCorrected().getFids(0), aligned.getFids(3));
  }

  @Test
  public void parallelMatchesSequential() {
    Spectrum[] subspectra = TestUtils.fourWaySubspectra();
    AlignmentConfiguration parallelConfig = new AlignmentConfiguration();
    parallelConfig.setParallel(true);
    parallelConfig.setThreads(3);

    SubspectrumAlignment sequential =
        sequentialAligner().align(EditingMode.HERCULES, subspectra);
    SubspectrumAlignment parallel =
        new SubspectrumAligner(parallelConfig).align(EditingMode.HERCULES, subspectra);

    assertEquals(sequential.getCorrections(), parallel.getCorrections());
    for (int i = 0; i < 4; ++i) {
      assertArrayEquals(sequential.getAligned().getFids(i), parallel.getAligned().getFids(i));
    }
  }

  @Test
  public void parallelRunPropagatesPreconditionFailure() {
    AlignmentConfiguration config = new AlignmentConfiguration();
    config.setParallel(true);
    config.setWindow(40., 50.);
    Spectrum[] subspectra = TestUtils.fourWaySubspectra();
    assertRejected(Reason.EMPTY_WINDOW,
        () -> new SubspectrumAligner(config).align(EditingMode.HERMES, subspectra));
  }

  @Test
  public void listenersSeeEachStep() {
    SubspectrumAligner aligner = sequentialAligner();
    List<String> statuses = new ArrayList<>();
    aligner.addChangeListener(e -> statuses.add(aligner.getStatus()));
    aligner.align(EditingMode.HERMES, TestUtils.fourWaySubspectra());

    assertTrue(statuses.contains("Aligning B onto A..."));
    assertTrue(statuses.contains("Aligning C onto A..."));
    assertTrue(statuses.contains("Aligning D onto C..."));
    assertTrue(statuses.indexOf("Aligning C onto A...")
        < statuses.indexOf("Aligning D onto C..."));
    assertEquals("Alignment done!", aligner.getStatus());
  }

  @Test
  public void rejectsSingleSubspectrum() {
    Spectrum single = TestUtils.single(TestUtils.baseFid());
    assertRejected(Reason.SUBSPECTRUM_COUNT,
        () -> sequentialAligner().align(single, EditingMode.MEGA));
  }

  @Test
  public void rejectsCountNotMatchingMode() {
    Spectrum packed = TestUtils.packed(TestUtils.baseFid(), TestUtils.baseFid());
    assertRejected(Reason.SUBSPECTRUM_COUNT,
        () -> sequentialAligner().align(packed, EditingMode.HERMES));
    Spectrum[] four = TestUtils.fourWaySubspectra();
    assertRejected(Reason.SUBSPECTRUM_COUNT,
        () -> sequentialAligner().align(EditingMode.MEGA, four));
  }

  @Test
  public void rejectsPackedInputInSeparatedForm() {
    Spectrum packed = TestUtils.packed(TestUtils.baseFid(), TestUtils.baseFid());
    Spectrum single = TestUtils.single(TestUtils.baseFid());
    assertRejected(Reason.SUBSPECTRUM_COUNT,
        () -> sequentialAligner().align(EditingMode.MEGA, single, packed));
  }

  @Test
  public void rejectsUncombinedOrUnaveragedData() {
    Spectrum packed = TestUtils.packed(TestUtils.baseFid(), TestUtils.baseFid());
    assertRejected(Reason.NOT_COIL_COMBINED, () -> sequentialAligner()
        .align(packed.withProcessingFlags(false, true), EditingMode.MEGA));
    assertRejected(Reason.NOT_AVERAGED, () -> sequentialAligner()
        .align(packed.withProcessingFlags(true, false), EditingMode.MEGA));

    Spectrum single = TestUtils.single(TestUtils.baseFid());
    assertRejected(Reason.NOT_AVERAGED, () -> sequentialAligner()
        .alignPair(single, single.withProcessingFlags(true, false)));
  }

  @Test
  public void rejectsMissingMode() {
    Spectrum packed = TestUtils.packed(TestUtils.baseFid(), TestUtils.baseFid());
    assertRejected(Reason.UNSUPPORTED_MODE,
        () -> sequentialAligner().align(packed, null));
  }

  @Test
  public void rejectsSeparatedInputsOnDifferentAxes() {
    Spectrum a = TestUtils.single(TestUtils.baseFid());
    Spectrum b = Spectrum.fromFids(TestUtils.baseFid(), TestUtils.SPECTRAL_WIDTH, 123.2,
        TestUtils.ECHO_TIME);
    assertRejected(Reason.AXIS_MISMATCH,
        () -> sequentialAligner().align(EditingMode.MEGA, a, b));
  }

  @Test
  public void reportCoversEveryStep() {
    SubspectrumAlignment result =
        sequentialAligner().align(EditingMode.HERMES, TestUtils.fourWaySubspectra());
    String report = result.getReportString();
    assertTrue(report.contains("B onto A"));
    assertTrue(report.contains("D onto C"));
    assertFalse(result.anySuspicious());
  }

  @Test
  public void defaultConstructorAlignsPair() {
    Spectrum a = TestUtils.single(TestUtils.baseFid());
    PairwiseAlignment result =
        new SubspectrumAligner().alignPair(a, TestUtils.shifted(a, 1., 0.));
    assertEquals(-1., result.getCorrection().getFrequencyShift(), 0.5);
  }

  @Test
  public void parallelRunNotifiesOnCallingThread() {
    AlignmentConfiguration config = new AlignmentConfiguration();
    config.setParallel(true);
    config.setThreads(3);
    SubspectrumAligner aligner = new SubspectrumAligner(config);
    List<Thread> threads = new ArrayList<>();
    List<String> statuses = new ArrayList<>();
    aligner.addChangeListener(e -> {
      threads.add(Thread.currentThread());
      statuses.add(aligner.getStatus());
    });
    aligner.align(EditingMode.HERMES, TestUtils.fourWaySubspectra());

    assertTrue(statuses.contains("Aligning B onto A..."));
    assertTrue(statuses.contains("Aligning D onto C..."));
    for (Thread thread : threads) {
      assertSame(Thread.currentThread(), thread);
    }
  }

}
