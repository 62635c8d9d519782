package org.pragmatica.cddl.ast;

/**
 * Marker for every node kind of the CDDL syntax tree.
 *
 * <p>The tree is owned top-down: interior nodes hold their children by value and no node
 * refers to its parent. Upward navigation is provided separately by
 * {@code org.pragmatica.cddl.tree.ParentIndex}.
 */
public sealed interface CddlNode
    permits Document, Rule, TypeRule, GroupRule, Type, TypeChoice, Type1, Operator, Type2,
            Group, GroupChoice, GroupEntry, ValueMemberKeyEntry, TypeGroupnameEntry, Occurrence,
            MemberKey, NonMemberKey, GenericParams, GenericParam, GenericArgs, GenericArg,
            Identifier, Value {
}
