package uk.gegc.questionnaire.features.paper.domain.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import uk.gegc.questionnaire.features.paper.domain.model.Paper;

import java.util.UUID;

@Repository
public interface PaperRepository extends JpaRepository<Paper, UUID> {
}
