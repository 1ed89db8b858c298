/**
 * Request and response shapes of the HTTP API.
 *
 * <p>Domain types never cross the boundary directly; paths are rendered as plain strings and
 * missing optional fields are omitted.
 */
package com.phillippitts.mediatoolbox.presentation.dto;
