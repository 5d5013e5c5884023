package com.realdonation.registry.api;

import com.realdonation.registry.api.ProjectRequests.CreateProject;
import com.realdonation.registry.api.ProjectRequests.Donate;
import com.realdonation.registry.api.ProjectRequests.ModifyDescription;
import com.realdonation.registry.api.ProjectResponses.CreatedProject;
import com.realdonation.registry.api.ProjectResponses.DescriptionView;
import com.realdonation.registry.api.ProjectResponses.DonatedAmount;
import com.realdonation.registry.api.ProjectResponses.ProjectView;
import com.realdonation.registry.domain.DescriptionIndex;
import com.realdonation.registry.domain.DonationRegistry;
import com.realdonation.registry.domain.ProjectId;
import com.realdonation.security.Address;
import com.realdonation.security.CallerAddressExtractor;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.PutMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestHeader;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

/**
 * HTTP surface of the registry. Mutations identify the caller through the
 * {@value CallerAddressExtractor#HEADER} header; reads need no caller.
 */
@RestController
@RequestMapping("/api/v1/projects")
public class ProjectController {

    private final DonationRegistry registry;
    private final DescriptionIndex descriptions;

    public ProjectController(DonationRegistry registry, DescriptionIndex descriptions) {
        this.registry = registry;
        this.descriptions = descriptions;
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public CreatedProject create(
            @RequestHeader(value = CallerAddressExtractor.HEADER, required = false) String caller,
            @Valid @RequestBody CreateProject request) {
        ProjectId id = registry.create(
                CallerAddressExtractor.require(caller), request.name(), request.description());
        return new CreatedProject(id.toHex());
    }

    @PutMapping("/{id}/description")
    public ResponseEntity<Void> modifyDescription(
            @RequestHeader(value = CallerAddressExtractor.HEADER, required = false) String caller,
            @PathVariable String id,
            @Valid @RequestBody ModifyDescription request) {
        registry.modifyDescription(CallerAddressExtractor.require(caller), ProjectId.parse(id), request.description());
        return ResponseEntity.noContent().build();
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> cease(
            @RequestHeader(value = CallerAddressExtractor.HEADER, required = false) String caller,
            @PathVariable String id) {
        registry.cease(CallerAddressExtractor.require(caller), ProjectId.parse(id));
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{id}/donations")
    public ResponseEntity<Void> donate(
            @RequestHeader(value = CallerAddressExtractor.HEADER, required = false) String caller,
            @PathVariable String id,
            @Valid @RequestBody Donate request) {
        registry.donate(
                CallerAddressExtractor.require(caller), ProjectId.parse(id), request.amount(), request.message());
        return ResponseEntity.noContent().build();
    }

    @GetMapping("/{id}")
    public ProjectView getProject(@PathVariable String id) {
        return ProjectView.of(registry.getProject(ProjectId.parse(id)));
    }

    @GetMapping("/{id}/description")
    public ResponseEntity<DescriptionView> getDescription(@PathVariable String id) {
        ProjectId projectId = ProjectId.parse(id);
        return descriptions.currentDescription(projectId)
                .map(text -> ResponseEntity.ok(new DescriptionView(projectId.toHex(), text)))
                .orElseGet(() -> ResponseEntity.notFound().build());
    }

    @GetMapping("/{id}/donations/{donor}")
    public DonatedAmount getDonated(@PathVariable String id, @PathVariable String donor) {
        ProjectId projectId = ProjectId.parse(id);
        Address donorAddress = Address.parse(donor);
        return DonatedAmount.of(projectId.toHex(), donorAddress, registry.getDonated(donorAddress, projectId));
    }
}
