package dao.tron.bridge.service;

import dao.tron.bridge.model.Capability;

/**
 * Decides who may call which operation. Resolved outside the control plane.
 */
public interface AuthorizationPolicy {

    boolean can(String caller, Capability capability);
}
