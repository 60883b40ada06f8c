package tech.cids.platform.token.template;

import java.util.List;
import java.util.Optional;

/**
 * Repository interface for TokenTemplate entities.
 */
public interface TokenTemplateRepository {

    // Read operations
    Optional<TokenTemplate> findByName(String name);
    List<TokenTemplate> listTemplates();
    List<TokenTemplate> findEnabled();

    // Write operations
    void persist(TokenTemplate template);
    void update(TokenTemplate template);
    boolean deleteByName(String name);
}
