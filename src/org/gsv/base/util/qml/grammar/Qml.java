package org.gsv.base.util.qml.grammar;

/**
 * Class at the root of the QML hierarchy.  All parts of a formula of Quantified Modal Logic are represented by objects
 * that are part of this hierarchy.
 *
 * <h1>The QML hierarchy</h1>
 *
 * <ul>
 *
 * <li><b>Formula</b>: A formula is something that updates an information state.  Formulas do not have a truth value of
 *     their own; their meaning is the change they bring about in a state.<ul>
 *
 *   <li><b>Unary</b>: A <i>formula</i> made up of an operator (negation, epistemic necessity or epistemic possibility)
 *       and a single <i>formula</i>, known as its scope.
 *
 *   <li><b>Binary</b>: A <i>formula</i> made up of an operator (conjunction, disjunction or conditional) and two
 *       <i>formulas</i>, the left hand side and the right hand side.
 *
 *   <li><b>Quantification</b>: A <i>formula</i> made up of a quantifier (existential or universal), the
 *       <i>variable</i> it binds and a <i>formula</i>, known as its scope.
 *
 *   <li><b>Identity</b>: A declaration that two <i>terms</i> denote the same individual.
 *
 *   <li><b>Predication</b>: A <i>formula</i> made up of a predicate name and a body consisting of <i>terms</i>.</ul>
 *
 * <li><b>Term</b>: A term is a <i>constant</i> or a <i>variable</i>.  It's what fills one "slot" in the body of a
 *     <i>predication</i> or either side of an <i>identity</i>.<ul>
 *
 *   <li><b>Constant</b>: A name whose denotation at each world is fixed by the model.
 *
 *   <li><b>Variable</b>: A name whose denotation is fixed by a possibility, through the peg that its referent system
 *       associates with it.</ul>
 *
 * </ul>
 *
 * <h1>Worked example</h1>
 *
 * <p><pre>{@code
 * (Ex P(x) -> <>Q(x, c))}</pre>
 *
 * <ul>
 *   <li>The whole thing is a <i>binary</i> with the conditional operator.
 *   <li><code>Ex P(x)</code> is an existential <i>quantification</i> over the <i>variable</i> <code>x</code>.  Its
 *       scope is the <i>predication</i> <code>P(x)</code>.
 *   <li><code>&lt;&gt;Q(x, c)</code> is a <i>unary</i> with the epistemic possibility operator.  Its scope is the
 *       <i>predication</i> <code>Q(x, c)</code> of arity 2, where <code>c</code> is a <i>constant</i>.  Because
 *       quantifiers bind dynamically, the <code>x</code> in the consequent picks up the peg introduced by the
 *       antecedent.
 * </ul>
 *
 * Instances are obtained from {@link QmlPool}.
 */
public abstract class Qml
{
  @Override
  public abstract String toString();
}
