package com.cofre.backend.services;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.UUID;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;

import com.cofre.backend.exceptions.ResourceNotFoundException;
import com.cofre.backend.repositories.PersonRepository;
import com.cofre.backend.repositories.SavingsRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Cria a poupança vazia dentro da transação de quem chamou, com insert que ignora conflito
 * na unique de owner_id. Uma criação concorrente espera o commit da outra e não insere nada.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SavingsAccountInitializer {

    private final PersonRepository personRepository;
    private final SavingsRepository savingsRepository;
    private final Clock clock;

    /**
     * @return true quando esta chamada criou a conta
     */
    @Transactional(propagation = Propagation.MANDATORY)
    public boolean createIfAbsent(UUID ownerId) {
        if (!personRepository.existsById(ownerId)) {
            throw new ResourceNotFoundException("Pessoa não encontrada");
        }

        int inserted = savingsRepository.insertEmptyIfAbsent(UUID.randomUUID(), ownerId, LocalDateTime.now(clock));
        if (inserted > 0) {
            log.info("Poupança criada para {}", ownerId);
            return true;
        }
        log.debug("Poupança de {} criada concorrentemente; reutilizando a existente", ownerId);
        return false;
    }
}
