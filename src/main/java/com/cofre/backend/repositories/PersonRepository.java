package com.cofre.backend.repositories;

import java.util.UUID;

import org.springframework.data.jpa.repository.JpaRepository;

import com.cofre.backend.entities.Person;

public interface PersonRepository extends JpaRepository<Person, UUID> {
}
