package dev.clarityhub.api;

/** Request header carrying the caller's tenant, set by the authenticating gateway. */
final class TenantHeader {

  static final String NAME = "X-Tenant-Id";

  private TenantHeader() {}
}
