/**
 * HTTP error mapping: invalid contest data and bean validation failures are 400, other domain
 * failures 422, anything else 500 without internal detail.
 */
package com.electionlens.boothrecon.presentation.exception;
