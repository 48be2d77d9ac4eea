package com.fieldpilot.lifecycle.repository;

import com.fieldpilot.lifecycle.model.Client;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

public interface ClientRepository extends JpaRepository<Client, UUID> {
}
