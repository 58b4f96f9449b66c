package com.example.agentdeployer.repository;

import com.example.agentdeployer.domain.Client;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ClientRepository extends JpaRepository<Client, String> {

    List<Client> findAllByOrderByCreatedAtDesc();
}
