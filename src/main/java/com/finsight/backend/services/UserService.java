package com.finsight.backend.services;

import java.util.UUID;

import org.springframework.stereotype.Service;

import com.finsight.backend.entities.Person;
import com.finsight.backend.entities.User;
import com.finsight.backend.exceptions.BadRequestException;
import com.finsight.backend.exceptions.ResourceNotFoundException;
import com.finsight.backend.repositories.PersonRepository;
import com.finsight.backend.repositories.UserRepository;

import lombok.RequiredArgsConstructor;

@Service
@RequiredArgsConstructor
public class UserService {

    private final UserRepository userRepository;
    private final PersonRepository personRepository;

    public User findById(String id) {
        return userRepository.findById(parseId(id, "user"))
                .orElseThrow(() -> new ResourceNotFoundException("User not found"));
    }

    public User findByEmail(String email) {
        return userRepository.findByEmail(email)
                .orElseThrow(() -> new ResourceNotFoundException("User not found with this email"));
    }

    public Person findPerson(String personId) {
        return personRepository.findById(parseId(personId, "person"))
                .orElseThrow(() -> new ResourceNotFoundException("Person not found"));
    }

    static UUID parseId(String id, String what) {
        if (id == null || id.isBlank()) {
            throw new BadRequestException("Missing " + what + " id");
        }
        try {
            return UUID.fromString(id.trim());
        } catch (IllegalArgumentException e) {
            throw new BadRequestException("Invalid " + what + " id: " + id);
        }
    }
}
