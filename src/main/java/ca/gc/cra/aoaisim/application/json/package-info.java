/**
 * JSON parsing and rendering over the Jackson streaming API.
 *
 * @since 0.1.0
 */
package ca.gc.cra.aoaisim.application.json;
