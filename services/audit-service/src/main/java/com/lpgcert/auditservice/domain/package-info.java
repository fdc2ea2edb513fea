/**
 * Audit domain: emitters, enrichment, the write path, queries and retention.
 *
 * <ul>
 *   <li>Domain MUST NOT depend on infrastructure or api packages
 *   <li>Storage is reached only through the {@link com.lpgcert.auditservice.domain.AuditLogStore}
 *       port
 *   <li>Servlet types stay at the web edge; the domain sees {@link
 *       com.lpgcert.auditservice.domain.enrichment.RequestSnapshot} copies
 * </ul>
 */
package com.lpgcert.auditservice.domain;
