package it.unimib.datai.berth.common.model;

public record ImageReference(String repository, String tag) {
    public ImageReference {
        if (repository == null || repository.isBlank()) {
            throw new IllegalArgumentException("Image repository is required");
        }
        if (tag == null || tag.isBlank()) {
            tag = "latest";
        }
    }

    public String fullName() {
        return repository + ":" + tag;
    }

    public ImageReference withTag(String newTag) {
        return new ImageReference(repository, newTag);
    }
}
