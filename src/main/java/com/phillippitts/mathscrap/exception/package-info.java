/**
 * Application-specific exception hierarchy.
 *
 * <p>Exception Hierarchy:
 * <ul>
 *   <li>{@link com.phillippitts.mathscrap.exception.MathScrapException} - Base exception
 *       for all application-specific errors</li>
 *   <li>{@link com.phillippitts.mathscrap.exception.RecognitionException} - A recognition
 *       backend failed for one image; carries the backend name and failure kind</li>
 *   <li>{@link com.phillippitts.mathscrap.exception.BackendUnavailableException} - A
 *       backend's runtime, binary or model data is missing</li>
 *   <li>{@link com.phillippitts.mathscrap.exception.UnreadableImageException} - The input
 *       image is missing, undecodable, or too large</li>
 *   <li>{@link com.phillippitts.mathscrap.exception.ExpressionParseException} - Internal
 *       parse failure, always converted into an unparseable marker</li>
 * </ul>
 *
 * <p>Recoverable conditions (backend failure, garbled output, unparseable markup) never
 * reach API callers as exceptions; they degrade confidence or detail in the result.
 *
 * @see com.phillippitts.mathscrap.presentation.exception.GlobalExceptionHandler
 */
package com.phillippitts.mathscrap.exception;
