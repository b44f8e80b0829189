package dao.tron.bridge.service;

import dao.tron.bridge.model.Capability;

import java.util.Set;

/**
 * Authorization policy whose validator and relayer grants governance can change.
 */
public interface RoleRegistry extends AuthorizationPolicy {

    void grant(String account, Capability capability);

    void revoke(String account, Capability capability);

    Set<String> holders(Capability capability);
}
