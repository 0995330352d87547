package com.donorid.dataset;

import com.donorid.exception.SourceTableException;
import com.donorid.model.clinical.*;
import com.donorid.model.enums.RepeatDecedentPolicy;
import lombok.Builder;

import java.util.*;
import java.util.function.UnaryOperator;

/**
 * The ten source tables of one site, loaded once and read-only for the run.
 * <p>
 * Hospitalizations are exposed as encounter blocks: with stitching enabled, back-to-back stays of a patient are
 * combined and every event row of a member is found under the block's id.
 */
public final class ClinicalDataset {

    private final Map<String, Patient> patientsById;
    private final List<Hospitalization> hospitalizations;
    private final Map<String, EncounterBlock> blocksById;
    private final int repeatDecedentsLeftOut;
    private final InMemoryEventTable<AdtRecord> adt;
    private final InMemoryEventTable<LabResult> labs;
    private final InMemoryEventTable<VitalSign> vitals;
    private final InMemoryEventTable<RespiratorySupport> respiratorySupport;
    private final InMemoryEventTable<MicrobiologyCulture> microbiology;
    private final InMemoryEventTable<CrrtTherapy> crrt;
    private final InMemoryEventTable<PatientAssessment> assessments;
    private final Map<String, List<HospitalDiagnosis>> diagnosesByHospitalization;
    private final int rowsWithoutKey;

    /**
     * @param stitcher             encounter stitching; null disables it
     * @param repeatDecedentPolicy handling of patients with several expired encounters; null evaluates all
     * @throws SourceTableException when a table is missing or a key column is empty throughout
     */
    @Builder
    private ClinicalDataset(List<Patient> patients,
                            List<Hospitalization> hospitalizations,
                            EncounterStitcher stitcher,
                            RepeatDecedentPolicy repeatDecedentPolicy,
                            List<AdtRecord> adt,
                            List<LabResult> labs,
                            List<VitalSign> vitals,
                            List<RespiratorySupport> respiratorySupport,
                            List<MicrobiologyCulture> microbiology,
                            List<CrrtTherapy> crrt,
                            List<PatientAssessment> assessments,
                            List<HospitalDiagnosis> diagnoses) {
        this.patientsById = indexPatients(patients);
        List<EncounterBlock> blocks = (stitcher != null ? stitcher : EncounterStitcher.disabled())
            .stitch(validateHospitalizations(hospitalizations));
        List<EncounterBlock> kept = repeatDecedentPolicy == RepeatDecedentPolicy.KEEP_LAST
            ? keepLastDeath(blocks)
            : blocks;
        this.repeatDecedentsLeftOut = blocks.size() - kept.size();
        this.blocksById = indexBlocks(kept);
        this.hospitalizations = kept.stream().map(EncounterBlock::hospitalization).toList();

        Map<String, String> blockByMember = new HashMap<>();
        for (EncounterBlock block : blocks) {
            block.memberIds().forEach(member -> blockByMember.put(member, block.getId()));
        }
        UnaryOperator<String> toBlock = id -> blockByMember.getOrDefault(id, id);
        this.adt = new InMemoryEventTable<>("adt", adt, toBlock);
        this.labs = new InMemoryEventTable<>("labs", labs, toBlock);
        this.vitals = new InMemoryEventTable<>("vitals", vitals, toBlock);
        this.respiratorySupport = new InMemoryEventTable<>("respiratory_support", respiratorySupport, toBlock);
        this.microbiology = new InMemoryEventTable<>("microbiology_culture", microbiology, toBlock);
        this.crrt = new InMemoryEventTable<>("crrt_therapy", crrt, toBlock);
        this.assessments = new InMemoryEventTable<>("patient_assessments", assessments, toBlock);
        this.diagnosesByHospitalization = indexDiagnoses(diagnoses, toBlock);

        int dropped = this.adt.getRowsWithoutKey() + this.labs.getRowsWithoutKey()
            + this.vitals.getRowsWithoutKey() + this.respiratorySupport.getRowsWithoutKey()
            + this.microbiology.getRowsWithoutKey() + this.crrt.getRowsWithoutKey()
            + this.assessments.getRowsWithoutKey();
        dropped += (int) diagnoses.stream().filter(d -> d.getHospitalizationId() == null).count();
        dropped += (int) patients.stream().filter(p -> p.getPatientId() == null).count();
        dropped += (int) hospitalizations.stream()
            .filter(h -> h.getHospitalizationId() == null || h.getPatientId() == null).count();
        this.rowsWithoutKey = dropped;
    }

    private static Map<String, Patient> indexPatients(List<Patient> patients) {
        if (patients == null) {
            throw new SourceTableException("patient", "table is missing");
        }
        if (!patients.isEmpty() && patients.stream().allMatch(p -> p.getPatientId() == null)) {
            throw new SourceTableException("patient", "required column patient_id is empty");
        }
        Map<String, Patient> index = new HashMap<>();
        for (Patient patient : patients) {
            if (patient.getPatientId() != null) {
                index.put(patient.getPatientId(), patient);
            }
        }
        return Collections.unmodifiableMap(index);
    }

    private static List<Hospitalization> validateHospitalizations(List<Hospitalization> hospitalizations) {
        if (hospitalizations == null) {
            throw new SourceTableException("hospitalization", "table is missing");
        }
        if (!hospitalizations.isEmpty()) {
            if (hospitalizations.stream().allMatch(h -> h.getHospitalizationId() == null)) {
                throw new SourceTableException("hospitalization", "required column hospitalization_id is empty");
            }
            if (hospitalizations.stream().allMatch(h -> h.getPatientId() == null)) {
                throw new SourceTableException("hospitalization", "required column patient_id is empty");
            }
        }
        return hospitalizations.stream()
            .filter(h -> h.getHospitalizationId() != null && h.getPatientId() != null)
            .toList();
    }

    /**
     * Per patient, drops every expired block except the one discharged last. Survivor blocks are untouched.
     */
    private static List<EncounterBlock> keepLastDeath(List<EncounterBlock> blocks) {
        Comparator<EncounterBlock> byDischarge = Comparator
            .comparing((EncounterBlock b) -> b.hospitalization().getDischargeDttm(),
                Comparator.nullsFirst(Comparator.naturalOrder()))
            .thenComparing(EncounterBlock::getId);
        Map<String, EncounterBlock> lastDeath = new HashMap<>();
        for (EncounterBlock block : blocks) {
            if (block.hospitalization().isExpired()) {
                lastDeath.merge(block.hospitalization().getPatientId(), block,
                    (a, b) -> byDischarge.compare(a, b) >= 0 ? a : b);
            }
        }
        return blocks.stream()
            .filter(b -> !b.hospitalization().isExpired()
                || lastDeath.get(b.hospitalization().getPatientId()) == b)
            .toList();
    }

    private static Map<String, EncounterBlock> indexBlocks(List<EncounterBlock> blocks) {
        Map<String, EncounterBlock> index = new LinkedHashMap<>();
        for (EncounterBlock block : blocks) {
            index.put(block.getId(), block);
        }
        return Collections.unmodifiableMap(index);
    }

    private static Map<String, List<HospitalDiagnosis>> indexDiagnoses(List<HospitalDiagnosis> diagnoses,
                                                                       UnaryOperator<String> toBlock) {
        if (diagnoses == null) {
            throw new SourceTableException("hospital_diagnosis", "table is missing");
        }
        if (!diagnoses.isEmpty() && diagnoses.stream().allMatch(d -> d.getHospitalizationId() == null)) {
            throw new SourceTableException("hospital_diagnosis", "required column hospitalization_id is empty");
        }
        Map<String, List<HospitalDiagnosis>> index = new HashMap<>();
        for (HospitalDiagnosis diagnosis : diagnoses) {
            if (diagnosis.getHospitalizationId() != null) {
                index.computeIfAbsent(toBlock.apply(diagnosis.getHospitalizationId()), k -> new ArrayList<>())
                    .add(diagnosis);
            }
        }
        return Collections.unmodifiableMap(index);
    }

    public Optional<Patient> findPatient(String patientId) {
        return Optional.ofNullable(patientsById.get(patientId));
    }

    /**
     * One hospitalization per encounter block with both keys present, ordered by id.
     */
    public List<Hospitalization> getHospitalizations() {
        return hospitalizations;
    }

    /**
     * Source hospitalization ids combined under {@code hospitalizationId}; a single id when nothing was stitched.
     */
    public List<String> findMemberIds(String hospitalizationId) {
        EncounterBlock block = blocksById.get(hospitalizationId);
        return block != null ? block.memberIds() : List.of(hospitalizationId);
    }

    public long getStitchedBlockCount() {
        return blocksById.values().stream().filter(EncounterBlock::isStitched).count();
    }

    /**
     * Earlier expired encounters left out under {@link RepeatDecedentPolicy#KEEP_LAST}.
     */
    public int getRepeatDecedentsLeftOut() {
        return repeatDecedentsLeftOut;
    }

    public int getPatientCount() {
        return patientsById.size();
    }

    public EventTable<AdtRecord> getAdt() {
        return adt;
    }

    public EventTable<LabResult> getLabs() {
        return labs;
    }

    public EventTable<VitalSign> getVitals() {
        return vitals;
    }

    public EventTable<RespiratorySupport> getRespiratorySupport() {
        return respiratorySupport;
    }

    public EventTable<MicrobiologyCulture> getMicrobiology() {
        return microbiology;
    }

    public EventTable<CrrtTherapy> getCrrt() {
        return crrt;
    }

    public EventTable<PatientAssessment> getAssessments() {
        return assessments;
    }

    public List<HospitalDiagnosis> findDiagnoses(String hospitalizationId) {
        return diagnosesByHospitalization.getOrDefault(hospitalizationId, List.of());
    }

    /**
     * Rows skipped at load because a key column was empty.
     */
    public int getRowsWithoutKey() {
        return rowsWithoutKey;
    }
}
