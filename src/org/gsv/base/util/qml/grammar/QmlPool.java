package org.gsv.base.util.qml.grammar;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import com.google.common.collect.ImmutableList;

/**
 * The only way to create QML objects.  Constants and variables are pooled so that each name has exactly one instance;
 * compound formulas are built fresh and are immutable once built.
 */
public final class QmlPool
{
  private static final Map<String, QmlConstant> constantPool = new ConcurrentHashMap<>();
  private static final Map<String, QmlVariable> variablePool = new ConcurrentHashMap<>();

  private QmlPool()
  {
  }

  public static QmlConstant getConstant(String value)
  {
    QmlConstant ret = constantPool.get(value);
    if (ret == null)
    {
      ret = new QmlConstant(value);
      QmlConstant prev = constantPool.putIfAbsent(value, ret);
      if (prev != null)
      {
        ret = prev;
      }
    }
    return ret;
  }

  public static QmlVariable getVariable(String name)
  {
    QmlVariable ret = variablePool.get(name);
    if (ret == null)
    {
      ret = new QmlVariable(name);
      QmlVariable prev = variablePool.putIfAbsent(name, ret);
      if (prev != null)
      {
        ret = prev;
      }
    }
    return ret;
  }

  public static QmlUnary getNot(QmlFormula scope)
  {
    return new QmlUnary(QmlOperator.NEGATION, scope);
  }

  public static QmlUnary getNecessity(QmlFormula scope)
  {
    return new QmlUnary(QmlOperator.EPISTEMIC_NECESSITY, scope);
  }

  public static QmlUnary getPossibility(QmlFormula scope)
  {
    return new QmlUnary(QmlOperator.EPISTEMIC_POSSIBILITY, scope);
  }

  public static QmlUnary getUnary(QmlOperator operator, QmlFormula scope)
  {
    return new QmlUnary(operator, scope);
  }

  public static QmlBinary getAnd(QmlFormula lhs, QmlFormula rhs)
  {
    return new QmlBinary(QmlOperator.CONJUNCTION, lhs, rhs);
  }

  public static QmlBinary getOr(QmlFormula lhs, QmlFormula rhs)
  {
    return new QmlBinary(QmlOperator.DISJUNCTION, lhs, rhs);
  }

  public static QmlBinary getIf(QmlFormula lhs, QmlFormula rhs)
  {
    return new QmlBinary(QmlOperator.CONDITIONAL, lhs, rhs);
  }

  public static QmlBinary getBinary(QmlOperator operator, QmlFormula lhs, QmlFormula rhs)
  {
    return new QmlBinary(operator, lhs, rhs);
  }

  public static QmlQuantification getExists(QmlVariable variable, QmlFormula scope)
  {
    return new QmlQuantification(QmlQuantifier.EXISTENTIAL, variable, scope);
  }

  public static QmlQuantification getForAll(QmlVariable variable, QmlFormula scope)
  {
    return new QmlQuantification(QmlQuantifier.UNIVERSAL, variable, scope);
  }

  public static QmlIdentity getIdentity(QmlTerm lhs, QmlTerm rhs)
  {
    return new QmlIdentity(lhs, rhs);
  }

  public static QmlPredication getPredication(String predicate, List<? extends QmlTerm> body)
  {
    return new QmlPredication(predicate, ImmutableList.<QmlTerm>copyOf(body));
  }

  public static QmlPredication getPredication(String predicate, QmlTerm... body)
  {
    return new QmlPredication(predicate, ImmutableList.copyOf(body));
  }

  /**
   * @return the negation of the given formula.
   */
  public static QmlUnary negate(QmlFormula formula)
  {
    return getNot(formula);
  }
}
