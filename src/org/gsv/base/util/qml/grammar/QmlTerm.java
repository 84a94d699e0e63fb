package org.gsv.base.util.qml.grammar;

/**
 * A term is a <i>constant</i> or a <i>variable</i>.  It's what fills one "slot" in the body of a <i>predication</i>.
 *
 * See {@link Qml} for a complete description of the QML hierarchy.
 */
public abstract class QmlTerm extends Qml
{
  /**
   * @return the literal name of this term.
   */
  public abstract String getName();

  /**
   * @return whether the denotation of this term is fixed by a possibility rather than by the model.
   */
  public abstract boolean isVariable();
}
