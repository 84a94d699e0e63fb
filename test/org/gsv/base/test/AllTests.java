package org.gsv.base.test;

import org.gsv.base.util.config.GSVConfigurationTest;
import org.gsv.base.util.evaluator.UpdateEvaluatorTest;
import org.gsv.base.util.logging.Log4jUpdateLoggerTest;
import org.gsv.base.util.qml.grammar.QmlPoolTest;
import org.gsv.base.util.relations.DeadlineTest;
import org.gsv.base.util.relations.DoubleNegationEquivalenceTest;
import org.gsv.base.util.relations.ParallelRelationsTest;
import org.gsv.base.util.relations.SemanticRelationsTest;
import org.gsv.base.util.relations.StateSearcherTest;
import org.gsv.base.util.relations.StateSpaceTest;
import org.gsv.base.util.semantics.InformationStateTest;
import org.gsv.base.util.semantics.PossibilityTest;
import org.gsv.base.util.semantics.ReferentSystemTest;
import org.junit.runner.RunWith;
import org.junit.runners.Suite;

@RunWith(Suite.class)
@Suite.SuiteClasses({QmlPoolTest.class,
                     ReferentSystemTest.class,
                     PossibilityTest.class,
                     InformationStateTest.class,
                     UpdateEvaluatorTest.class,
                     StateSpaceTest.class,
                     StateSearcherTest.class,
                     SemanticRelationsTest.class,
                     DoubleNegationEquivalenceTest.class,
                     ParallelRelationsTest.class,
                     DeadlineTest.class,
                     GSVConfigurationTest.class,
                     Log4jUpdateLoggerTest.class})
public class AllTests
{

}
