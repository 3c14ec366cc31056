/**
 * Catalogues of warehouse business rules, one class per aggregate.
 *
 * <p>Every factory method returns a named {@link com.criterion.specification.Specification} whose
 * {@code toString} reads like the rule, so composed rules print legibly. Parameters are checked
 * when the rule is built; evaluation never throws for well-formed records.
 */
package com.criterion.warehouse.specification;
