package org.gsv.base.util.relations;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.gsv.base.test.FiniteModel;
import org.gsv.base.util.exceptions.GSVException;
import org.gsv.base.util.exceptions.UndefinedTermException;
import org.gsv.base.util.exceptions.UpdateException;
import org.gsv.base.util.qml.grammar.QmlFormula;
import org.gsv.base.util.qml.grammar.QmlPool;
import org.gsv.base.util.qml.grammar.QmlVariable;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

/**
 * Checking states on several threads gives the same verdicts, and reports the same failures, as checking them in
 * order.
 */
public class ParallelRelationsTest extends Assert
{
  private static final QmlVariable x = QmlPool.getVariable("x");
  private static final QmlFormula Pc = QmlPool.getPredication("P", QmlPool.getConstant("c"));
  private static final QmlFormula Qc = QmlPool.getPredication("Q", QmlPool.getConstant("c"));
  private static final QmlFormula Pe = QmlPool.getPredication("P", QmlPool.getConstant("e"));
  private static final QmlFormula Px = QmlPool.getPredication("P", x);

  private static final List<QmlFormula> NO_PREMISES = Collections.emptyList();

  private FiniteModel model;
  private SemanticRelations sequential;
  private SemanticRelations parallel;

  @Before
  public void setUp()
  {
    // Five worlds, two individuals.  e is only defined at w0 and w1.
    model = new FiniteModel(5, 2).rigidTerm("c", 0)
                                 .term("e", 0, 1)
                                 .term("e", 1, 1)
                                 .fact("P", 0, 0)
                                 .fact("P", 0, 1)
                                 .fact("P", 1, 0)
                                 .fact("P", 3, 1)
                                 .fact("Q", 0, 0)
                                 .fact("Q", 2, 0);
    sequential = new SemanticRelations(null, 1, -1);
    parallel = new SemanticRelations(null, 4, -1);
  }

  @After
  public void tearDown()
  {
    sequential.close();
    parallel.close();
  }

  @Test
  public void testSameVerdicts() throws Exception
  {
    List<QmlFormula> lFormulas = Arrays.asList(Pc,
                                               QmlPool.getOr(Pc, QmlPool.getNot(Pc)),
                                               QmlPool.getPossibility(Qc),
                                               QmlPool.getNecessity(Pc),
                                               QmlPool.getExists(x, Px),
                                               QmlPool.getForAll(x, Px),
                                               QmlPool.getIf(Pc, Qc));

    for (QmlFormula lFormula : lFormulas)
    {
      assertEquals(lFormula.toString(),
                   sequential.consistent(lFormula, model),
                   parallel.consistent(lFormula, model));
      assertEquals(lFormula.toString(),
                   sequential.coherent(lFormula, model),
                   parallel.coherent(lFormula, model));
      assertEquals(lFormula.toString(),
                   sequential.entailsG(Arrays.asList(lFormula), Qc, model),
                   parallel.entailsG(Arrays.asList(lFormula), Qc, model));
      assertEquals(lFormula.toString(),
                   sequential.entailsC(Arrays.asList(Qc), lFormula, model),
                   parallel.entailsC(Arrays.asList(Qc), lFormula, model));
      assertEquals(lFormula.toString(),
                   sequential.equivalent(lFormula, QmlPool.getAnd(lFormula, Pc), model),
                   parallel.equivalent(lFormula, QmlPool.getAnd(lFormula, Pc), model));
    }

    assertTrue(parallel.entailsG(Arrays.asList(Pc, Qc), QmlPool.getAnd(Qc, Pc), model));
    assertFalse(parallel.entailsG(Arrays.asList(QmlPool.getPossibility(Pc)), Pc, model));
    assertTrue(parallel.entails0(Arrays.asList(QmlPool.getExists(x, Px)), Px, model));
  }

  @Test
  public void testCounterexampleBeforeFailureWins() throws Exception
  {
    // {w1} is a counterexample, and comes before {w2}, where e is undefined.
    assertFalse(sequential.entailsG(NO_PREMISES, Pe, model));
    assertFalse(parallel.entailsG(NO_PREMISES, Pe, model));
  }

  @Test
  public void testFirstFailureIsReported()
  {
    String lSequential = failure(sequential, Pe);
    String lParallel = failure(parallel, Pe);

    assertEquals(lSequential, lParallel);
    assertEquals("In evaluating formula P(e):\nNon-existent term: e (at w2)", lParallel);
  }

  private String failure(SemanticRelations xiRelations, QmlFormula xiFormula)
  {
    try
    {
      xiRelations.equivalent(xiFormula, xiFormula, model);
      fail("Expected the undefined term to be reported");
      return null;
    }
    catch (UpdateException lEx)
    {
      assertTrue(lEx.getRootCause() instanceof UndefinedTermException);
      return lEx.getMessage();
    }
    catch (GSVException lEx)
    {
      throw new AssertionError("Unexpected failure " + lEx, lEx);
    }
  }
}
