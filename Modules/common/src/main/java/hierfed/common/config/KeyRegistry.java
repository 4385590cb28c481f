package hierfed.common.config;

import hierfed.common.crypto.KeyFiles;

import java.io.IOException;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.PublicKey;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Public keys of the infrastructure members (authority, leader, fog nodes, validators).
 * Facility keys are not listed here: they travel inside authority-signed identity certificates.
 */
public class KeyRegistry {
    public enum Role { AUTHORITY, LEADER, FOG, VALIDATOR }

    private final Map<Role, Map<String, PublicKey>> keys = new HashMap<>();

    public KeyRegistry() {
        for (Role r : Role.values()) keys.put(r, new HashMap<>());
    }

    public static KeyRegistry from(DeploymentConfig config, Path baseDir) throws IOException, GeneralSecurityException {
        KeyRegistry registry = new KeyRegistry();
        registry.load(Role.AUTHORITY, config.authority, baseDir);
        registry.load(Role.LEADER, config.leader, baseDir);
        for (var fog : config.fogNodes) registry.load(Role.FOG, fog, baseDir);
        for (var v : config.validators) registry.load(Role.VALIDATOR, v, baseDir);
        return registry;
    }

    private void load(Role role, DeploymentConfig.Member member, Path baseDir) throws IOException, GeneralSecurityException {
        if (member == null || member.publicKeyPath == null || member.publicKeyPath.isBlank()) {
            throw new IllegalStateException("Trust invalid: no publicKeyPath for " + role + " " + (member == null ? "?" : member.id));
        }
        put(role, member.id, KeyFiles.loadPublicKeyPem(baseDir.resolve(member.publicKeyPath)));
    }

    public KeyRegistry put(Role role, String id, PublicKey key) {
        keys.get(role).put(id, key);
        return this;
    }

    public Optional<PublicKey> key(Role role, String id) {
        return Optional.ofNullable(keys.get(role).get(id));
    }

    public int count(Role role) {
        return keys.get(role).size();
    }
}
