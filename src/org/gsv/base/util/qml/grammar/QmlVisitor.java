package org.gsv.base.util.qml.grammar;

/**
 * Visitor over the closed set of formula kinds.  Adding a formula kind means adding a method here, so every visitor
 * has to handle it.
 *
 * @param <R> - the result type.
 * @param <E> - the checked exception a visit may raise.
 */
public interface QmlVisitor<R, E extends Exception>
{
  public R visitUnary(QmlUnary formula) throws E;
  public R visitBinary(QmlBinary formula) throws E;
  public R visitQuantification(QmlQuantification formula) throws E;
  public R visitIdentity(QmlIdentity formula) throws E;
  public R visitPredication(QmlPredication formula) throws E;
}
