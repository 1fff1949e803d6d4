/**
 * Client for the QuestDB HTTP {@code /exec} endpoint and the read-your-writes check built on it.
 *
 * <h2>Errors</h2>
 * <ul>
 *   <li>{@link io.qdbcompat.query.TransportException} - connection failure or non-200 status</li>
 *   <li>{@link io.qdbcompat.query.QueryErrorException} - the server answered with an {@code error} field</li>
 *   <li>{@link io.qdbcompat.query.MalformedResponseException} - the body is not a well-formed result</li>
 * </ul>
 * Only the first two are retried by {@link io.qdbcompat.query.ConsistencyCheck}.
 */
package io.qdbcompat.query;
