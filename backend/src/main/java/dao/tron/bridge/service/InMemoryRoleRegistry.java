package dao.tron.bridge.service;

import dao.tron.bridge.config.BridgeProperties;
import dao.tron.bridge.model.Capability;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.*;

@Slf4j
@Component
public class InMemoryRoleRegistry implements RoleRegistry {

    private final Map<Capability, Set<String>> holders = new EnumMap<>(Capability.class);

    public InMemoryRoleRegistry(BridgeProperties props) {
        for (Capability c : Capability.values()) {
            holders.put(c, new LinkedHashSet<>());
        }
        BridgeProperties.Roles roles = props.getRoles();
        seed(Capability.ADMIN, roles.getAdmins());
        seed(Capability.PROPOSER, roles.getProposers());
        seed(Capability.APPROVER, roles.getApprovers());
        seed(Capability.VALIDATOR, roles.getValidators());
        seed(Capability.RELAYER, roles.getRelayers());

        log.info("RoleRegistry initialized: admins={}, proposers={}, approvers={}, validators={}, relayers={}",
                holders.get(Capability.ADMIN).size(),
                holders.get(Capability.PROPOSER).size(),
                holders.get(Capability.APPROVER).size(),
                holders.get(Capability.VALIDATOR).size(),
                holders.get(Capability.RELAYER).size());
    }

    @Override
    public synchronized boolean can(String caller, Capability capability) {
        return caller != null && holders.get(capability).contains(caller.trim());
    }

    @Override
    public synchronized void grant(String account, Capability capability) {
        if (holders.get(capability).add(account.trim())) {
            log.info("Granted {} to {}", capability, account);
        }
    }

    @Override
    public synchronized void revoke(String account, Capability capability) {
        if (holders.get(capability).remove(account.trim())) {
            log.info("Revoked {} from {}", capability, account);
        }
    }

    @Override
    public synchronized Set<String> holders(Capability capability) {
        return Collections.unmodifiableSet(new LinkedHashSet<>(holders.get(capability)));
    }

    private void seed(Capability capability, List<String> configured) {
        if (configured == null) return;
        // Spring may bind a list as one comma-separated string (e.g. from env).
        for (String entry : configured) {
            if (entry == null) continue;
            for (String part : entry.split(",")) {
                String p = part.trim();
                if (!p.isEmpty()) holders.get(capability).add(p);
            }
        }
    }
}
