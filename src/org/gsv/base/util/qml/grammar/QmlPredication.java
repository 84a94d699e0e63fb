package org.gsv.base.util.qml.grammar;

import java.util.List;

/**
 * A <i>predication</i> applies a predicate to a body of <i>terms</i>.  The arity of a predication is the number of
 * terms in its body.
 *
 * See {@link Qml} for a complete description of the QML hierarchy.
 */
public final class QmlPredication extends QmlFormula
{

  private final String        predicate;
  private final List<QmlTerm> body;

  QmlPredication(String predicate, List<QmlTerm> body)
  {
    this.predicate = predicate.intern();
    this.body = body;
  }

  public int arity()
  {
    return body.size();
  }

  public QmlTerm get(int index)
  {
    return body.get(index);
  }

  public String getPredicate()
  {
    return predicate;
  }

  public List<QmlTerm> getBody()
  {
    return body;
  }

  @Override
  public <R, E extends Exception> R accept(QmlVisitor<R, E> visitor) throws E
  {
    return visitor.visitPredication(this);
  }

  @Override
  public String toString()
  {
    if (body.isEmpty())
    {
      return predicate;
    }

    StringBuilder sb = new StringBuilder();

    sb.append(predicate + "(");
    for (int i = 0; i < body.size(); i++)
    {
      if (i > 0)
      {
        sb.append(", ");
      }
      sb.append(body.get(i));
    }
    sb.append(")");

    return sb.toString();
  }

}
