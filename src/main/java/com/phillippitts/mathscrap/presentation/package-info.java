/**
 * Presentation layer (REST API controllers and exception handling).
 *
 * <p>Controllers are thin adapters over the service layer:
 * <ul>
 *   <li>{@code GET /ping} - liveness</li>
 *   <li>{@code POST /api/expressions/validate} - symbolic validation of markup</li>
 *   <li>{@code POST /api/expressions/solve} - equation solving</li>
 *   <li>{@code POST /api/images/analyze} - full image pipeline, completed asynchronously</li>
 * </ul>
 *
 * @see com.phillippitts.mathscrap.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.mathscrap.presentation;
