package socialjobs.worker.repository;

import socialjobs.worker.model.VerticalProfile;

import java.util.Optional;

/**
 * Read access to vertical prompt profiles.
 */
public interface VerticalProfileRepository {

    /**
     * Find an active profile by key.
     *
     * @param verticalKey the vertical key
     * @return the profile if it exists and is active
     */
    Optional<VerticalProfile> findActive(String verticalKey);

    /**
     * Insert or replace a profile.
     */
    void save(VerticalProfile profile, boolean active);

    /**
     * Profile for the key, falling back to {@code general}, then to the built-in default.
     */
    default VerticalProfile resolve(String verticalKey) {
        String key = verticalKey == null || verticalKey.isBlank() ? VerticalProfile.GENERAL : verticalKey;
        Optional<VerticalProfile> profile = findActive(key);
        if (profile.isEmpty() && !VerticalProfile.GENERAL.equals(key)) {
            profile = findActive(VerticalProfile.GENERAL);
        }
        return profile.orElseGet(() -> VerticalProfile.builtInDefault(key));
    }
}
