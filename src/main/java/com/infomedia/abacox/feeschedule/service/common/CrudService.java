package com.infomedia.abacox.feeschedule.service.common;

import lombok.Getter;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.JpaSpecificationExecutor;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;

/**
 * Base class for entity services: lookup by id, filtered paging and persistence through one repository.
 */
@Getter
public abstract class CrudService<E, I, R extends JpaRepository<E, I> & JpaSpecificationExecutor<E>> {

    private final R repository;

    protected CrudService(R repository) {
        this.repository = repository;
    }

    @Transactional(readOnly = true)
    public Page<E> find(Specification<E> specification, Pageable pageable) {
        return repository.findAll(specification, pageable);
    }

    @Transactional(readOnly = true)
    public List<E> findAll() {
        return repository.findAll();
    }

    @Transactional(readOnly = true)
    public E get(I id) {
        return repository.findById(id)
                .orElseThrow(() -> new ResourceNotFoundException(entityName(), id));
    }

    @Transactional
    public E save(E entity) {
        return repository.save(entity);
    }

    @Transactional
    public List<E> saveAll(List<E> entities) {
        return repository.saveAll(entities);
    }

    @Transactional
    public void deleteById(I id) {
        E entity = get(id);
        repository.delete(entity);
    }

    protected abstract String entityName();
}
