package org.gsv.base.util.evaluator;

import org.gsv.base.util.exceptions.UpdateException;
import org.gsv.base.util.qml.grammar.QmlFormula;
import org.gsv.base.util.semantics.InformationState;
import org.gsv.base.util.semantics.Model;

public interface Evaluator
{
  /**
   * @return the update of the state with the formula.  The input state is left unchanged.
   *
   * @throws UpdateException if the update is undefined - some term, predicate or variable in the formula has no
   *         interpretation where it is needed.
   */
  public InformationState update(QmlFormula formula, InformationState state, Model model) throws UpdateException;
}
