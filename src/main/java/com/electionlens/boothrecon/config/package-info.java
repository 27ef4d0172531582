/**
 * Application-wide configuration beans and properties.
 *
 * <p>Configuration Classes:
 * <ul>
 *   <li>{@link com.electionlens.boothrecon.config.MappingConfig} - registers the column
 *       mapping strategies</li>
 *   <li>{@link com.electionlens.boothrecon.config.ThreadPoolConfig} - executor for parallel
 *       contest processing</li>
 * </ul>
 *
 * <p>Sub-packages:
 * <ul>
 *   <li>{@code config.properties} - typed {@code contest.*} and {@code threadpool.*} properties</li>
 *   <li>{@code config.logging} - MDC filter</li>
 * </ul>
 */
package com.electionlens.boothrecon.config;
