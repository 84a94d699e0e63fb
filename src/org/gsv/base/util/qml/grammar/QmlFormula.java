package org.gsv.base.util.qml.grammar;

/**
 * A formula is something that updates an information state.
 *
 * See {@link Qml} for a complete description of the QML hierarchy.
 */
public abstract class QmlFormula extends Qml
{
  /**
   * Dispatch to the visitor method for the concrete kind of this formula.
   *
   * @param visitor - the visitor.
   *
   * @return whatever the visitor returns.
   * @throws E if the visitor does.
   */
  public abstract <R, E extends Exception> R accept(QmlVisitor<R, E> visitor) throws E;
}
