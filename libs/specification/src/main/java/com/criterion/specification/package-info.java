/**
 * Composable business rules (the Specification pattern).
 *
 * <p>Contains:
 *
 * <ul>
 *   <li>{@link com.criterion.specification.Specification}: the evaluation and combinator
 *       contract
 *   <li>{@link com.criterion.specification.CompositeSpecification}: the closed set of AND, OR,
 *       NOT, AND NOT and OR NOT composites
 *   <li>{@link com.criterion.specification.Specifications}: adapters, constants and folds
 * </ul>
 *
 * <p>Collection filtering lives in {@code com.criterion.specification.collection}; reusable number
 * and string rules in {@code com.criterion.specification.common}.
 */
package com.criterion.specification;
