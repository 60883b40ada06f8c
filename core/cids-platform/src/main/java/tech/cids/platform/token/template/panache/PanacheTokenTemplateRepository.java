package tech.cids.platform.token.template.panache;

import io.quarkus.hibernate.orm.panache.PanacheRepositoryBase;
import jakarta.enterprise.context.ApplicationScoped;
import tech.cids.platform.token.template.TokenTemplate;
import tech.cids.platform.token.template.TokenTemplateRepository;
import tech.cids.platform.token.template.entity.TokenTemplateEntity;
import tech.cids.platform.token.template.mapper.TokenTemplateMapper;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Panache-based implementation of TokenTemplateRepository.
 */
@ApplicationScoped
public class PanacheTokenTemplateRepository
    implements TokenTemplateRepository, PanacheRepositoryBase<TokenTemplateEntity, String> {

    @Override
    public Optional<TokenTemplate> findByName(String name) {
        return find("name", name)
            .firstResultOptional()
            .map(TokenTemplateMapper::toDomain);
    }

    @Override
    public List<TokenTemplate> listTemplates() {
        return find("order by priority desc, name").list().stream()
            .map(TokenTemplateMapper::toDomain)
            .toList();
    }

    @Override
    public List<TokenTemplate> findEnabled() {
        return find("enabled = true order by priority desc, name").list().stream()
            .map(TokenTemplateMapper::toDomain)
            .toList();
    }

    @Override
    public void persist(TokenTemplate template) {
        if (template.createdAt == null) {
            template.createdAt = Instant.now();
        }
        template.updatedAt = Instant.now();
        persist(TokenTemplateMapper.toEntity(template));
    }

    @Override
    public void update(TokenTemplate template) {
        template.updatedAt = Instant.now();
        TokenTemplateEntity entity = findById(template.id);
        if (entity != null) {
            TokenTemplateMapper.updateEntity(entity, template);
        }
    }

    @Override
    public boolean deleteByName(String name) {
        return delete("name", name) > 0;
    }
}
